package com.pikdrive.booking.model;

import com.pikdrive.booking.enums.PaymentProvider;
import com.pikdrive.booking.enums.TransactionStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One attempt to collect money for the unpaid seats of a booking.
 * <p>
 * {@code activeBookingId} mirrors {@code bookingId} while the transaction is
 * {@code INITIATED} or {@code PENDING} and is cleared on the terminal
 * transition; its unique constraint allows one active transaction per booking.
 */
@Entity
@Table(name = "payment_transactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_payment_tx_active_booking", columnNames = "active_booking_id"),
        indexes = {
                @Index(name = "idx_payment_tx_booking", columnList = "booking_id"),
                @Index(name = "idx_payment_tx_reference", columnList = "provider, external_reference"),
                @Index(name = "idx_payment_tx_status", columnList = "status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PaymentTransaction {

    @Id
    @Column(name = "transaction_id", length = 36)
    String transactionId;

    @Column(name = "booking_id", nullable = false, length = 36)
    String bookingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 16)
    PaymentProvider provider;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    String currency;

    @Column(name = "phone_number", nullable = false, length = 20)
    String phoneNumber;

    /** Booking seat count this transaction pays up to. */
    @Column(name = "seat_count", nullable = false)
    Integer seatCount;

    @Column(name = "external_reference", length = 100)
    String externalReference;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    @Builder.Default
    TransactionStatus status = TransactionStatus.INITIATED;

    @Column(name = "active_booking_id", length = 36)
    String activeBookingId;

    @Column(name = "failure_reason", length = 255)
    String failureReason;

    @Version
    @Column(name = "version")
    Long version;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;

    @Column(name = "resolved_at")
    LocalDateTime resolvedAt;

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
