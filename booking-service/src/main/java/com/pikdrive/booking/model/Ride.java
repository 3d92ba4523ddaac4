package com.pikdrive.booking.model;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "rides")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Ride {

    @Id
    @Column(name = "ride_id", length = 36)
    String rideId;

    @Column(name = "driver_id", nullable = false, length = 36)
    String driverId;

    @Column(name = "from_city", nullable = false, length = 100)
    String fromCity;

    @Column(name = "to_city", nullable = false, length = 100)
    String toCity;

    @Column(name = "departure_time", nullable = false)
    LocalDateTime departureTime;

    @Column(name = "price_per_seat", nullable = false, precision = 10, scale = 2)
    BigDecimal pricePerSeat;

    @Column(name = "total_seats", nullable = false)
    Integer totalSeats;

    @Column(name = "committed_seats", nullable = false)
    @Builder.Default
    Integer committedSeats = 0;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;

    public int availableSeats() {
        return Math.max(0, totalSeats - committedSeats);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
