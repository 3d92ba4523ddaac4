package com.pikdrive.booking.client;

import com.pikdrive.booking.enums.ProviderStatus;
import com.pikdrive.booking.exception.PaymentGatewayException;
import com.pikdrive.booking.util.PhoneNumbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Shared plumbing for the Cameroonian mobile money providers: number
 * validation, XAF rounding and limits, OAuth token caching and translation of
 * HTTP failures into {@link PaymentGatewayException} codes.
 */
@Slf4j
public abstract class AbstractMobileMoneyGateway implements PaymentGateway {

    private static final long TOKEN_EXPIRY_SKEW_SECONDS = 60;

    protected final RestTemplate restTemplate;
    private final BigDecimal minAmount;
    private final BigDecimal maxAmount;

    private AccessToken accessToken;

    protected AbstractMobileMoneyGateway(RestTemplate restTemplate, BigDecimal minAmount, BigDecimal maxAmount) {
        this.restTemplate = restTemplate;
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
    }

    protected abstract Pattern nationalNumberPattern();

    protected abstract AccessToken fetchAccessToken();

    protected abstract ExternalTransactionRef doInitiate(PaymentInitiation initiation);

    protected abstract ProviderStatus doQueryStatus(String externalReference);

    @Override
    public String normalizePhoneNumber(String phoneNumber) {
        String national = PhoneNumbers.toNationalNumber(phoneNumber)
                .filter(number -> nationalNumberPattern().matcher(number).matches())
                .orElseThrow(() -> PaymentGatewayException.invalidPhoneNumber(provider().name()));
        return PhoneNumbers.toInternational(national);
    }

    @Override
    public BigDecimal chargeableAmount(BigDecimal amount) {
        BigDecimal rounded = amount.setScale(0, RoundingMode.HALF_UP);
        if (rounded.compareTo(minAmount) < 0 || rounded.compareTo(maxAmount) > 0) {
            throw new PaymentGatewayException(PaymentGatewayException.AMOUNT_OUT_OF_RANGE,
                    "Amount " + rounded.toPlainString() + " is outside the " + provider() + " limits ["
                            + minAmount.toPlainString() + ", " + maxAmount.toPlainString() + "]");
        }
        return rounded;
    }

    @Override
    public ExternalTransactionRef initiate(PaymentInitiation initiation) {
        log.info("Initiating {} payment: transactionId={}, amount={}, phone={}", provider(),
                initiation.getTransactionId(), initiation.getAmount(), PhoneNumbers.mask(initiation.getPhoneNumber()));

        ExternalTransactionRef ref = doInitiate(initiation);

        log.info("{} payment accepted: transactionId={}, reference={}",
                provider(), initiation.getTransactionId(), ref.getReference());
        return ref;
    }

    @Override
    public ProviderStatus queryStatus(String externalReference) {
        try {
            ProviderStatus status = doQueryStatus(externalReference);
            log.debug("{} status: reference={}, status={}", provider(), externalReference, status);
            return status;
        } catch (RestClientException e) {
            PaymentGatewayException failure = translate("status query", e, externalReference);
            log.warn("{} status query failed: reference={}, error={}", provider(), externalReference, failure.getMessage());
            return ProviderStatus.UNKNOWN;
        } catch (PaymentGatewayException e) {
            log.warn("{} status query failed: reference={}, error={}", provider(), externalReference, e.getMessage());
            return ProviderStatus.UNKNOWN;
        }
    }

    protected synchronized String accessToken() {
        if (accessToken == null || accessToken.isExpired()) {
            accessToken = fetchAccessToken();
        }
        return accessToken.getValue();
    }

    protected synchronized void invalidateAccessToken() {
        accessToken = null;
    }

    /**
     * Client errors are definitive rejections. Connection and read failures mean
     * the request may or may not have reached the provider.
     */
    protected PaymentGatewayException translate(String operation, RestClientException e, String reference) {
        if (e instanceof HttpClientErrorException) {
            int statusCode = ((HttpClientErrorException) e).getStatusCode().value();
            if (statusCode == 401) {
                invalidateAccessToken();
            }
            return PaymentGatewayException.rejected(provider() + " rejected " + operation + ": " + statusCode,
                    reference, e);
        }
        if (e instanceof ResourceAccessException) {
            return PaymentGatewayException.timeout(provider() + " did not answer " + operation, reference, e);
        }
        return PaymentGatewayException.unknown(provider() + " " + operation + " failed: " + e.getMessage(), reference, e);
    }

    protected static final class AccessToken {

        private final String value;
        private final Instant expiresAt;

        public AccessToken(String value, long expiresInSeconds) {
            this.value = value;
            this.expiresAt = Instant.now().plusSeconds(Math.max(0, expiresInSeconds - TOKEN_EXPIRY_SKEW_SECONDS));
        }

        public String getValue() {
            return value;
        }

        boolean isExpired() {
            return Instant.now().isAfter(expiresAt);
        }
    }
}
