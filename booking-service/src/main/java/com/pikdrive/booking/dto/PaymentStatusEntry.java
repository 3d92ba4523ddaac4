package com.pikdrive.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PaymentStatusEntry {

    String bookingId;
    String transactionId;
    String status;
    String bookingStatus;
    String message;
}
