package com.pikdrive.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class RideEntry {

    String rideId;
    String driverId;
    String fromCity;
    String toCity;
    LocalDateTime departureTime;
    BigDecimal pricePerSeat;
    Integer totalSeats;
    Integer availableSeats;
    LocalDateTime createdAt;
}
