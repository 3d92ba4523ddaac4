package com.pikdrive.booking.enums;

/**
 * Payment state of a booking.
 * <p>
 * {@code AWAITING_PAYMENT -> PAYMENT_IN_PROGRESS -> COMPLETED | FAILED}, with
 * {@code COMPLETED -> AWAITING_PAYMENT} for seat top-ups and a direct
 * {@code AWAITING_PAYMENT -> FAILED} when a provider rejects the initiation.
 */
public enum BookingPaymentStatus {
    AWAITING_PAYMENT,
    PAYMENT_IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED
}
