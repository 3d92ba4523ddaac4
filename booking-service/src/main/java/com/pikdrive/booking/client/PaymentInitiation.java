package com.pikdrive.booking.client;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PaymentInitiation {

    String transactionId;
    BigDecimal amount;
    String currency;
    /** International form, e.g. 2376XXXXXXXX. */
    String phoneNumber;
    String description;
}
