package com.pikdrive.booking.repository;

import com.pikdrive.booking.model.Ride;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RideRepository extends JpaRepository<Ride, String> {

    @Modifying
    @Query("UPDATE Ride r SET r.committedSeats = r.committedSeats + :seats " +
            "WHERE r.rideId = :rideId AND r.committedSeats + :seats <= r.totalSeats")
    int reserveSeats(@Param("rideId") String rideId, @Param("seats") int seats);

    @Modifying
    @Query("UPDATE Ride r SET r.committedSeats = " +
            "CASE WHEN r.committedSeats > :seats THEN r.committedSeats - :seats ELSE 0 END " +
            "WHERE r.rideId = :rideId")
    int releaseSeats(@Param("rideId") String rideId, @Param("seats") int seats);

    @Query("SELECT r.totalSeats - r.committedSeats FROM Ride r WHERE r.rideId = :rideId")
    Optional<Integer> findAvailableSeats(@Param("rideId") String rideId);
}
