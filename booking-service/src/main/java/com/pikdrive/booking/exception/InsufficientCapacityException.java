package com.pikdrive.booking.exception;

import lombok.Getter;

/**
 * Thrown when a ride cannot hold the requested seats. Carries the
 * availability observed at the time of the failed reservation.
 */
@Getter
public class InsufficientCapacityException extends BookingException {

    public static final String INSUFFICIENT_CAPACITY = "INSUFFICIENT_CAPACITY";

    private final String rideId;
    private final int requestedSeats;
    private final int availableSeats;

    public InsufficientCapacityException(String rideId, int requestedSeats, int availableSeats) {
        super(INSUFFICIENT_CAPACITY, "Only " + availableSeats + " seats left on ride " + rideId
                + ", requested " + requestedSeats);
        this.rideId = rideId;
        this.requestedSeats = requestedSeats;
        this.availableSeats = availableSeats;
    }
}
