package com.pikdrive.booking.constants;

import java.math.BigDecimal;

public final class PaymentConstants {

    private PaymentConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String DEFAULT_CURRENCY = "XAF";
    public static final BigDecimal DEFAULT_MIN_AMOUNT = new BigDecimal("100");
    public static final BigDecimal DEFAULT_MAX_AMOUNT = new BigDecimal("500000");

    public static final int DEFAULT_POLL_INTERVAL_SECONDS = 10;
    public static final int DEFAULT_POLL_MAX_ATTEMPTS = 30;

    public static final String CAMEROON_CALLING_CODE = "237";
    public static final int NATIONAL_NUMBER_LENGTH = 9;

    public static final String SIGNATURE_HEADER = "X-Signature";
    public static final String SIGNATURE_ALGORITHM = "HmacSHA256";

    public static final String REASON_ABANDONED = "Payment abandoned by rider";
    public static final String REASON_POLL_EXHAUSTED = "No final status from provider after polling";
    public static final String REASON_RESERVATION_EXPIRED = "Reservation TTL elapsed before payment completed";

    public static final String MESSAGE_NO_PAYMENT = "No payment has been initiated for this booking";
    public static final String MESSAGE_INITIATED = "Payment request is being sent to the provider";
    public static final String MESSAGE_PENDING = "Payment is pending, confirm the request on your phone";
    public static final String MESSAGE_SUCCEEDED = "Payment completed";
    public static final String MESSAGE_FAILED = "Payment failed";
    public static final String MESSAGE_EXPIRED = "Payment expired without confirmation";
}
