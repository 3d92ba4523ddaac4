package com.pikdrive.booking.util;

import com.pikdrive.booking.constants.BookingConstants;

import java.util.UUID;

public final class IdGenerator {

    private static final int UUID_SUBSTRING_LENGTH = 12;

    private IdGenerator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String generateRideId() {
        return BookingConstants.RIDE_ID_PREFIX + randomSuffix();
    }

    public static String generateBookingId() {
        return BookingConstants.BOOKING_ID_PREFIX + randomSuffix();
    }

    public static String generateTransactionId() {
        return BookingConstants.TRANSACTION_ID_PREFIX + randomSuffix();
    }

    private static String randomSuffix() {
        return UUID.randomUUID()
                .toString()
                .replace("-", "")
                .substring(0, UUID_SUBSTRING_LENGTH)
                .toUpperCase();
    }
}
