package com.pikdrive.booking.exception;

public class PaymentTransactionNotFoundException extends BookingException {

    public PaymentTransactionNotFoundException(String transactionId) {
        super("TRANSACTION_NOT_FOUND", "Payment transaction not found: " + transactionId);
    }
}
