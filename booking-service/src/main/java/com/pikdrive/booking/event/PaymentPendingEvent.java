package com.pikdrive.booking.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published once a payment transaction has been handed to its provider and is
 * waiting for a final status. Starts status polling for the transaction.
 */
@Getter
public class PaymentPendingEvent extends ApplicationEvent {

    private final String transactionId;
    private final String bookingId;

    public PaymentPendingEvent(Object source, String transactionId, String bookingId) {
        super(source);
        this.transactionId = transactionId;
        this.bookingId = bookingId;
    }
}
