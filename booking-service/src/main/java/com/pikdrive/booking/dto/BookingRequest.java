package com.pikdrive.booking.dto;

import com.pikdrive.booking.constants.ValidationMessages;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Requested seat total for a rider on a ride. Creates the booking or updates
 * the rider's live booking on that ride.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingRequest {

    @NotBlank(message = ValidationMessages.RIDE_ID_REQUIRED)
    String rideId;

    @NotBlank(message = ValidationMessages.RIDER_ID_REQUIRED)
    String riderId;

    @NotNull(message = ValidationMessages.SEATS_REQUIRED)
    Integer seats;
}
