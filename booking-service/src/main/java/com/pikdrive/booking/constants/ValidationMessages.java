package com.pikdrive.booking.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String RIDE_ID_REQUIRED = "Ride ID is required";
    public static final String RIDER_ID_REQUIRED = "Rider ID is required";
    public static final String DRIVER_ID_REQUIRED = "Driver ID is required";
    public static final String SEATS_REQUIRED = "Number of seats is required";
    public static final String SEATS_MIN = "At least 1 seat is required";
    public static final String SEATS_POSITIVE = "Seat count must be positive";

    public static final String FROM_CITY_REQUIRED = "Departure city is required";
    public static final String TO_CITY_REQUIRED = "Arrival city is required";
    public static final String DEPARTURE_TIME_REQUIRED = "Departure time is required";
    public static final String PRICE_REQUIRED = "Price per seat is required";
    public static final String PRICE_NOT_NEGATIVE = "Price per seat cannot be negative";

    public static final String PROVIDER_REQUIRED = "Payment provider is required";
    public static final String PHONE_NUMBER_REQUIRED = "Phone number is required";
    public static final String VERIFICATION_CODE_REQUIRED = "Verification code is required";

    public static final String BELOW_PAID_SEATS = "Cannot reduce seats below the %d seats already paid";
    public static final String TRANSACTION_IN_PROGRESS = "A payment is already in progress for booking %s";
    public static final String NOTHING_TO_CHARGE = "Booking %s has no unpaid seats";
}
