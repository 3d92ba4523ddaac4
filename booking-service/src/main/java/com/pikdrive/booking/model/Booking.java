package com.pikdrive.booking.model;

import com.pikdrive.booking.enums.BookingPaymentStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

/**
 * A rider's claim on seats of one ride.
 * <p>
 * {@code activeKey} is {@code rideId:riderId} while the booking is live and
 * {@code null} once it is cancelled, so the unique constraint admits at most
 * one live booking per (ride, rider).
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = @UniqueConstraint(name = "uk_bookings_active_key", columnNames = "active_key"),
        indexes = {
                @Index(name = "idx_bookings_rider", columnList = "rider_id"),
                @Index(name = "idx_bookings_status_updated", columnList = "payment_status, updated_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Booking {

    @Id
    @Column(name = "booking_id", length = 36)
    String bookingId;

    @Column(name = "ride_id", nullable = false, length = 36)
    String rideId;

    @Column(name = "rider_id", nullable = false, length = 36)
    String riderId;

    @Column(name = "seats", nullable = false)
    Integer seats;

    @Column(name = "paid_seats", nullable = false)
    @Builder.Default
    Integer paidSeats = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 32)
    @Builder.Default
    BookingPaymentStatus paymentStatus = BookingPaymentStatus.AWAITING_PAYMENT;

    @Column(name = "active_key", length = 80)
    String activeKey;

    @Column(name = "verification_code", length = 6)
    String verificationCode;

    @Column(name = "code_expires_at")
    LocalDateTime codeExpiresAt;

    @Column(name = "code_verified", nullable = false)
    @Builder.Default
    Boolean codeVerified = false;

    @Version
    @Column(name = "version")
    Long version;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;

    public static String activeKeyOf(String rideId, String riderId) {
        return rideId + ":" + riderId;
    }

    public int unpaidSeats() {
        return seats - paidSeats;
    }

    /**
     * Seats this booking currently holds against ride capacity.
     */
    public int heldSeats() {
        return switch (paymentStatus) {
            case AWAITING_PAYMENT, PAYMENT_IN_PROGRESS, COMPLETED -> seats;
            case FAILED -> paidSeats;
            case CANCELLED -> 0;
        };
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
