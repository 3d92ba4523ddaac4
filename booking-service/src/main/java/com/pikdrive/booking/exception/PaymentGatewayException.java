package com.pikdrive.booking.exception;

import lombok.Getter;

/**
 * Failure reported by a mobile money provider adapter.
 * <p>
 * Only {@link #PAYMENT_REJECTED} means the provider definitively refused the
 * request. Timeouts and unreadable responses leave the outcome unknown; when the
 * adapter knows the reference it sent, {@link #getExternalReference()} carries it
 * so the transaction can still be polled.
 */
@Getter
public class PaymentGatewayException extends RuntimeException {

    public static final String PAYMENT_REJECTED = "PAYMENT_REJECTED";
    public static final String PAYMENT_TIMEOUT = "PAYMENT_TIMEOUT";
    public static final String PAYMENT_UNKNOWN = "PAYMENT_UNKNOWN";
    public static final String INVALID_PHONE_NUMBER = "INVALID_PHONE_NUMBER";
    public static final String AMOUNT_OUT_OF_RANGE = "AMOUNT_OUT_OF_RANGE";
    public static final String UNSUPPORTED_PROVIDER = "UNSUPPORTED_PROVIDER";

    private final String errorCode;
    private final String externalReference;

    public PaymentGatewayException(String errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public PaymentGatewayException(String errorCode, String message, String externalReference, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.externalReference = externalReference;
    }

    public boolean isRejection() {
        return PAYMENT_REJECTED.equals(errorCode);
    }

    public boolean isOutcomeUnknown() {
        return PAYMENT_TIMEOUT.equals(errorCode) || PAYMENT_UNKNOWN.equals(errorCode);
    }

    public static PaymentGatewayException rejected(String message, String externalReference, Throwable cause) {
        return new PaymentGatewayException(PAYMENT_REJECTED, message, externalReference, cause);
    }

    public static PaymentGatewayException timeout(String message, String externalReference, Throwable cause) {
        return new PaymentGatewayException(PAYMENT_TIMEOUT, message, externalReference, cause);
    }

    public static PaymentGatewayException unknown(String message, String externalReference, Throwable cause) {
        return new PaymentGatewayException(PAYMENT_UNKNOWN, message, externalReference, cause);
    }

    public static PaymentGatewayException invalidPhoneNumber(String provider) {
        return new PaymentGatewayException(INVALID_PHONE_NUMBER,
                "Phone number is not a valid " + provider + " mobile money number");
    }

    public static PaymentGatewayException unsupportedProvider(String provider) {
        return new PaymentGatewayException(UNSUPPORTED_PROVIDER, "Unsupported payment provider: " + provider);
    }
}
