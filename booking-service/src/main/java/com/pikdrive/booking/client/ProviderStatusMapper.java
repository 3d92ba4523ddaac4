package com.pikdrive.booking.client;

import com.pikdrive.booking.enums.ProviderStatus;

import java.util.Locale;
import java.util.Set;

/**
 * Maps the status vocabulary of MTN MoMo and Orange Money onto
 * {@link ProviderStatus}.
 */
public final class ProviderStatusMapper {

    private static final Set<String> SUCCESS_STATUSES = Set.of(
            "SUCCESSFUL", "SUCCESSFULL", "SUCCESS", "COMPLETED");

    private static final Set<String> PENDING_STATUSES = Set.of(
            "PENDING", "ONGOING", "DELAYED", "INITIATED", "PROCESSING");

    private static final Set<String> EXPIRED_STATUSES = Set.of("EXPIRED", "TIMEOUT");

    private static final Set<String> FAILED_STATUSES = Set.of(
            "FAILED", "REJECTED", "CANCELLED", "NOT_ENOUGH_FUNDS", "PAYER_NOT_ALLOWED", "NOT_ALLOWED",
            "INVALID_CURRENCY", "ACCOUNT_NOT_FOUND", "ACCOUNT_HOLDER_NOT_FOUND", "ZERO_BALANCE",
            "NEGATIVE_BALANCE", "RESOURCE_NOT_FOUND", "PAYEE_NOT_FOUND", "COULD_NOT_PERFORM_TRANSACTION");

    private ProviderStatusMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ProviderStatus map(String providerStatus) {
        if (providerStatus == null || providerStatus.isBlank()) {
            return ProviderStatus.UNKNOWN;
        }

        String normalized = providerStatus.trim().toUpperCase(Locale.ROOT);
        if (SUCCESS_STATUSES.contains(normalized)) {
            return ProviderStatus.SUCCEEDED;
        }
        if (PENDING_STATUSES.contains(normalized)) {
            return ProviderStatus.PENDING;
        }
        if (EXPIRED_STATUSES.contains(normalized)) {
            return ProviderStatus.EXPIRED;
        }
        if (FAILED_STATUSES.contains(normalized)) {
            return ProviderStatus.FAILED;
        }
        // SERVICE_UNAVAILABLE, INTERNAL_PROCESSING_ERROR and anything new: ask again later
        return ProviderStatus.UNKNOWN;
    }
}
