package com.pikdrive.booking.client;

import com.pikdrive.booking.enums.PaymentProvider;
import com.pikdrive.booking.enums.ProviderStatus;

import java.math.BigDecimal;

/**
 * Provider-agnostic contract for collecting mobile money.
 */
public interface PaymentGateway {

    PaymentProvider provider();

    /**
     * Validates the number against the provider's prefixes.
     *
     * @return the number in international form
     * @throws com.pikdrive.booking.exception.PaymentGatewayException with code INVALID_PHONE_NUMBER
     */
    String normalizePhoneNumber(String phoneNumber);

    /**
     * Rounds to the amount actually debited and checks the provider limits.
     *
     * @throws com.pikdrive.booking.exception.PaymentGatewayException with code AMOUNT_OUT_OF_RANGE
     */
    BigDecimal chargeableAmount(BigDecimal amount);

    /**
     * Submits a collection request. Returning normally only means the provider
     * accepted the request; the payer still has to confirm it.
     *
     * @throws com.pikdrive.booking.exception.PaymentGatewayException PAYMENT_REJECTED on a definitive
     *         refusal, PAYMENT_TIMEOUT or PAYMENT_UNKNOWN when the outcome is unknown
     */
    ExternalTransactionRef initiate(PaymentInitiation initiation);

    /**
     * Never throws for transport problems; those map to {@link ProviderStatus#UNKNOWN}.
     */
    ProviderStatus queryStatus(String externalReference);
}
