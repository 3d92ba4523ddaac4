package com.pikdrive.booking.exception;

import com.pikdrive.booking.constants.ValidationMessages;
import lombok.Getter;

@Getter
public class BookingException extends RuntimeException {

    public static final String INVALID_SEAT_COUNT = "INVALID_SEAT_COUNT";
    public static final String CONCURRENT_MODIFICATION = "CONCURRENT_MODIFICATION";
    public static final String TRANSACTION_ALREADY_IN_PROGRESS = "TRANSACTION_ALREADY_IN_PROGRESS";
    public static final String NOTHING_TO_CHARGE = "NOTHING_TO_CHARGE";
    public static final String PAYMENT_REJECTED = "PAYMENT_REJECTED";
    public static final String BOOKING_CANCELLED = "BOOKING_CANCELLED";
    public static final String INVALID_RIDE = "INVALID_RIDE";

    private final String errorCode;
    private final boolean retryable;

    public BookingException(String errorCode, String message) {
        this(errorCode, message, false, null);
    }

    public BookingException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    public BookingException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public static BookingException invalidSeatCount(String message) {
        return new BookingException(INVALID_SEAT_COUNT, message);
    }

    public static BookingException belowPaidSeats(int paidSeats) {
        return invalidSeatCount(String.format(ValidationMessages.BELOW_PAID_SEATS, paidSeats));
    }

    public static BookingException concurrentModification(String message, Throwable cause) {
        return new BookingException(CONCURRENT_MODIFICATION, message, true, cause);
    }

    public static BookingException transactionAlreadyInProgress(String bookingId) {
        return new BookingException(TRANSACTION_ALREADY_IN_PROGRESS,
                String.format(ValidationMessages.TRANSACTION_IN_PROGRESS, bookingId));
    }

    public static BookingException nothingToCharge(String bookingId) {
        return new BookingException(NOTHING_TO_CHARGE,
                String.format(ValidationMessages.NOTHING_TO_CHARGE, bookingId));
    }

    public static BookingException paymentRejected(String bookingId, String reason) {
        return new BookingException(PAYMENT_REJECTED,
                "Payment for booking " + bookingId + " was rejected: " + reason);
    }

    public static BookingException bookingCancelled(String bookingId) {
        return new BookingException(BOOKING_CANCELLED, "Booking is cancelled: " + bookingId);
    }
}
