package com.pikdrive.booking.mapper;

import com.pikdrive.booking.dto.PaymentTransactionEntry;
import com.pikdrive.booking.model.PaymentTransaction;
import com.pikdrive.booking.util.PhoneNumbers;

public final class PaymentMapper {

    private PaymentMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static PaymentTransactionEntry toEntry(PaymentTransaction transaction) {
        if (transaction == null) {
            return null;
        }

        return PaymentTransactionEntry.builder()
                .transactionId(transaction.getTransactionId())
                .bookingId(transaction.getBookingId())
                .provider(transaction.getProvider() != null ? transaction.getProvider().name() : null)
                .amount(transaction.getAmount())
                .currency(transaction.getCurrency())
                .phoneNumber(PhoneNumbers.mask(transaction.getPhoneNumber()))
                .seatCount(transaction.getSeatCount())
                .status(transaction.getStatus() != null ? transaction.getStatus().name() : null)
                .externalReference(transaction.getExternalReference())
                .failureReason(transaction.getFailureReason())
                .createdAt(transaction.getCreatedAt())
                .resolvedAt(transaction.getResolvedAt())
                .build();
    }
}
