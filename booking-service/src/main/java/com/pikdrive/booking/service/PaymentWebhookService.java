package com.pikdrive.booking.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pikdrive.booking.client.PaymentGatewayRegistry;
import com.pikdrive.booking.client.ProviderStatusMapper;
import com.pikdrive.booking.constants.PaymentConstants;
import com.pikdrive.booking.dto.PaymentWebhookPayload;
import com.pikdrive.booking.enums.PaymentProvider;
import com.pikdrive.booking.enums.ProviderStatus;
import com.pikdrive.booking.exception.InvalidSignatureException;
import com.pikdrive.booking.model.PaymentTransaction;
import com.pikdrive.booking.repository.PaymentTransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

/**
 * Provider status notifications. A notification is one more way to reach
 * {@link PaymentOrchestrator#reconcile}; it races with polling and either order
 * gives the same result.
 */
@Service
@Slf4j
public class PaymentWebhookService {

    public static final String RESULT_PROCESSED = "PROCESSED";
    public static final String RESULT_IGNORED = "IGNORED";

    private final PaymentTransactionRepository transactionRepository;
    private final PaymentGatewayRegistry gatewayRegistry;
    private final PaymentStatusPoller statusPoller;
    private final ObjectMapper objectMapper;
    private final String webhookSecret;

    public PaymentWebhookService(
            PaymentTransactionRepository transactionRepository,
            PaymentGatewayRegistry gatewayRegistry,
            PaymentStatusPoller statusPoller,
            ObjectMapper objectMapper,
            @Value("${payment.webhook.secret:}") String webhookSecret) {
        this.transactionRepository = transactionRepository;
        this.gatewayRegistry = gatewayRegistry;
        this.statusPoller = statusPoller;
        this.objectMapper = objectMapper;
        this.webhookSecret = webhookSecret;
    }

    /**
     * @return {@link #RESULT_PROCESSED} when a transaction was resolved, otherwise {@link #RESULT_IGNORED}
     * @throws InvalidSignatureException when the signature does not match the body
     */
    public String handleNotification(String providerCode, String rawBody, String signature) {
        verifySignature(rawBody, signature);

        PaymentProvider provider = gatewayRegistry.resolveProvider(providerCode);
        PaymentWebhookPayload payload = parse(rawBody);

        Optional<PaymentTransaction> transaction = findTransaction(provider, payload);
        if (transaction.isEmpty()) {
            // acknowledged so the provider stops retrying
            log.warn("Notification for unknown transaction: provider={}, reference={}", provider, payload.getReference());
            return RESULT_IGNORED;
        }

        ProviderStatus status = ProviderStatusMapper.map(payload.getStatus());
        String transactionId = transaction.get().getTransactionId();
        log.info("Payment notification: provider={}, transactionId={}, status={}", provider, transactionId, status);

        if (!status.isTerminal()) {
            return RESULT_IGNORED;
        }

        String reason = StringUtils.hasText(payload.getReason())
                ? payload.getReason()
                : "Provider notified " + status.name().toLowerCase(Locale.ROOT);
        boolean applied = statusPoller.resolve(transactionId, status.toTransactionStatus(), reason);
        return applied ? RESULT_PROCESSED : RESULT_IGNORED;
    }

    void verifySignature(String rawBody, String signature) {
        if (!StringUtils.hasText(webhookSecret)) {
            log.error("Webhook secret is not configured, rejecting notification");
            throw new InvalidSignatureException("Webhook signature cannot be verified");
        }
        if (!StringUtils.hasText(signature)) {
            throw new InvalidSignatureException("Missing " + PaymentConstants.SIGNATURE_HEADER + " header");
        }

        byte[] expected = sign(rawBody).getBytes(StandardCharsets.UTF_8);
        byte[] actual = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, actual)) {
            log.warn("Webhook signature mismatch");
            throw new InvalidSignatureException("Invalid webhook signature");
        }
    }

    String sign(String rawBody) {
        try {
            Mac mac = Mac.getInstance(PaymentConstants.SIGNATURE_ALGORITHM);
            mac.init(new SecretKeySpec(webhookSecret.getBytes(StandardCharsets.UTF_8), PaymentConstants.SIGNATURE_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(rawBody.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

    private PaymentWebhookPayload parse(String rawBody) {
        try {
            return objectMapper.readValue(rawBody, PaymentWebhookPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed notification body", e);
        }
    }

    private Optional<PaymentTransaction> findTransaction(PaymentProvider provider, PaymentWebhookPayload payload) {
        if (StringUtils.hasText(payload.getReference())) {
            Optional<PaymentTransaction> byReference =
                    transactionRepository.findByProviderAndExternalReference(provider, payload.getReference());
            if (byReference.isPresent()) {
                return byReference;
            }
        }
        if (StringUtils.hasText(payload.getExternalId())) {
            return transactionRepository.findById(payload.getExternalId())
                    .filter(transaction -> transaction.getProvider() == provider);
        }
        return Optional.empty();
    }
}
