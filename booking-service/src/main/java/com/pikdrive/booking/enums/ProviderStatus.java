package com.pikdrive.booking.enums;

/**
 * Provider-agnostic view of a mobile money transaction.
 */
public enum ProviderStatus {
    PENDING,
    SUCCEEDED,
    FAILED,
    EXPIRED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == EXPIRED;
    }

    public TransactionStatus toTransactionStatus() {
        return switch (this) {
            case SUCCEEDED -> TransactionStatus.SUCCEEDED;
            case FAILED -> TransactionStatus.FAILED;
            case EXPIRED -> TransactionStatus.EXPIRED;
            case PENDING, UNKNOWN -> TransactionStatus.PENDING;
        };
    }
}
