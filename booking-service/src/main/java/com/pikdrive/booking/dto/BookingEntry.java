package com.pikdrive.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingEntry {

    String bookingId;
    String rideId;
    String riderId;
    Integer seats;
    Integer paidSeats;
    Integer unpaidSeats;
    String paymentStatus;
    String verificationCode;
    Boolean codeVerified;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
}
