package com.pikdrive.booking.repository;

import com.pikdrive.booking.enums.BookingPaymentStatus;
import com.pikdrive.booking.model.Booking;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<Booking, String> {

    Optional<Booking> findByActiveKey(String activeKey);

    /**
     * Loads the booking and bumps its version when the transaction commits, so
     * a seat change that read the booking earlier fails its version check.
     */
    @Lock(LockModeType.OPTIMISTIC_FORCE_INCREMENT)
    @Query("SELECT b FROM Booking b WHERE b.bookingId = :bookingId")
    Optional<Booking> findForPaymentClaim(@Param("bookingId") String bookingId);

    List<Booking> findByRiderIdOrderByCreatedAtDesc(String riderId);

    List<Booking> findByPaymentStatusAndUpdatedAtBefore(BookingPaymentStatus paymentStatus, LocalDateTime cutoff);
}
