package com.pikdrive.booking.dto;

import com.pikdrive.booking.constants.BookingConstants;
import com.pikdrive.booking.constants.ValidationMessages;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class RideRequest {

    @NotBlank(message = ValidationMessages.DRIVER_ID_REQUIRED)
    String driverId;

    @NotBlank(message = ValidationMessages.FROM_CITY_REQUIRED)
    String fromCity;

    @NotBlank(message = ValidationMessages.TO_CITY_REQUIRED)
    String toCity;

    @NotNull(message = ValidationMessages.DEPARTURE_TIME_REQUIRED)
    LocalDateTime departureTime;

    @NotNull(message = ValidationMessages.PRICE_REQUIRED)
    @DecimalMin(value = "0", message = ValidationMessages.PRICE_NOT_NEGATIVE)
    BigDecimal pricePerSeat;

    @NotNull(message = ValidationMessages.SEATS_REQUIRED)
    @Min(value = BookingConstants.MIN_SEATS_PER_BOOKING, message = ValidationMessages.SEATS_MIN)
    Integer totalSeats;
}
