package com.pikdrive.booking.enums;

import java.util.Locale;
import java.util.Optional;

public enum PaymentProvider {
    MTN,
    ORANGE;

    public static Optional<PaymentProvider> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (PaymentProvider provider : values()) {
            if (provider.name().equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
