package com.pikdrive.booking.enums;

import java.util.EnumSet;
import java.util.Set;

public enum TransactionStatus {
    INITIATED,
    PENDING,
    SUCCEEDED,
    FAILED,
    EXPIRED;

    public static final Set<TransactionStatus> ACTIVE = EnumSet.of(INITIATED, PENDING);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return !isActive();
    }
}
