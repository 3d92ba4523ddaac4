package com.pikdrive.booking.constants;

public final class BookingConstants {

    private BookingConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final int DEFAULT_RESERVATION_TTL_MINUTES = 15;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_EXPIRY_CHECK_INTERVAL_MS = 60000;
    public static final int DEFAULT_VERIFICATION_CODE_TTL_HOURS = 24;

    public static final int MIN_SEATS_PER_BOOKING = 1;
    public static final int VERIFICATION_CODE_LENGTH = 6;

    public static final String BOOKING_ID_PREFIX = "BK";
    public static final String RIDE_ID_PREFIX = "RD";
    public static final String TRANSACTION_ID_PREFIX = "PT";

    public static final String REDIS_AVAILABLE_SEATS_PREFIX = "ride:";
    public static final String REDIS_AVAILABLE_SEATS_SUFFIX = ":availableSeats";
    // bounds how long a count re-cached by a read racing an eviction can live
    public static final int AVAILABLE_SEATS_CACHE_TTL_SECONDS = 30;
}
