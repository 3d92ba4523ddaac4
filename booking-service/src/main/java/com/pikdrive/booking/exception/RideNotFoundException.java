package com.pikdrive.booking.exception;

public class RideNotFoundException extends BookingException {

    public RideNotFoundException(String rideId) {
        super("RIDE_NOT_FOUND", "Ride not found: " + rideId);
    }
}
