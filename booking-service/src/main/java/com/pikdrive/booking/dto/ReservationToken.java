package com.pikdrive.booking.dto;

import lombok.Value;

/**
 * Seats taken from a ride's capacity by one successful reserve call.
 */
@Value
public class ReservationToken {

    String rideId;
    int seats;
}
