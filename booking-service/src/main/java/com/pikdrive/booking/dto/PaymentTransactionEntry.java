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
public class PaymentTransactionEntry {

    String transactionId;
    String bookingId;
    String provider;
    BigDecimal amount;
    String currency;
    String phoneNumber;
    Integer seatCount;
    String status;
    String externalReference;
    String failureReason;
    LocalDateTime createdAt;
    LocalDateTime resolvedAt;
}
