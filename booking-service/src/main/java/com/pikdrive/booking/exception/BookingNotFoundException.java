package com.pikdrive.booking.exception;

public class BookingNotFoundException extends BookingException {

    public BookingNotFoundException(String bookingId) {
        super("BOOKING_NOT_FOUND", "Booking not found: " + bookingId);
    }
}
