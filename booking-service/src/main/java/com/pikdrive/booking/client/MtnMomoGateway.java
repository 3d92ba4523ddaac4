package com.pikdrive.booking.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.pikdrive.booking.enums.PaymentProvider;
import com.pikdrive.booking.enums.ProviderStatus;
import com.pikdrive.booking.exception.PaymentGatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MTN Mobile Money collection API (request-to-pay).
 */
@Component
@Slf4j
public class MtnMomoGateway extends AbstractMobileMoneyGateway {

    private static final Pattern MTN_NUMBER = Pattern.compile("^6(7\\d|[85][0-4])\\d{6}$");

    private static final String TOKEN_PATH = "/collection/token/";
    private static final String REQUEST_TO_PAY_PATH = "/collection/v1_0/requesttopay";
    private static final String SUBSCRIPTION_KEY_HEADER = "Ocp-Apim-Subscription-Key";
    private static final String SANDBOX_ENVIRONMENT = "sandbox";
    private static final String SANDBOX_CURRENCY = "EUR";
    private static final long DEFAULT_TOKEN_TTL_SECONDS = 3600;

    private final String baseUrl;
    private final String subscriptionKey;
    private final String apiUser;
    private final String apiKey;
    private final String targetEnvironment;
    private final String callbackUrl;

    public MtnMomoGateway(
            @Qualifier("mtnRestTemplate") RestTemplate restTemplate,
            @Value("${payment.providers.mtn.base-url:https://sandbox.momodeveloper.mtn.com}") String baseUrl,
            @Value("${payment.providers.mtn.subscription-key:}") String subscriptionKey,
            @Value("${payment.providers.mtn.api-user:}") String apiUser,
            @Value("${payment.providers.mtn.api-key:}") String apiKey,
            @Value("${payment.providers.mtn.target-environment:sandbox}") String targetEnvironment,
            @Value("${payment.providers.mtn.callback-url:}") String callbackUrl,
            @Value("${payment.limits.min-amount:100}") BigDecimal minAmount,
            @Value("${payment.limits.max-amount:500000}") BigDecimal maxAmount) {
        super(restTemplate, minAmount, maxAmount);
        this.baseUrl = baseUrl;
        this.subscriptionKey = subscriptionKey;
        this.apiUser = apiUser;
        this.apiKey = apiKey;
        this.targetEnvironment = targetEnvironment;
        this.callbackUrl = callbackUrl;
    }

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.MTN;
    }

    @Override
    protected Pattern nationalNumberPattern() {
        return MTN_NUMBER;
    }

    @Override
    protected AccessToken fetchAccessToken() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(apiUser, apiKey);
        headers.set(SUBSCRIPTION_KEY_HEADER, subscriptionKey);

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    baseUrl + TOKEN_PATH, HttpMethod.POST, new HttpEntity<>(headers), JsonNode.class);
            JsonNode body = response.getBody();
            String token = body != null ? body.path("access_token").asText("") : "";
            if (!StringUtils.hasText(token)) {
                throw PaymentGatewayException.unknown("MTN token response had no access_token", null, null);
            }
            return new AccessToken(token, body.path("expires_in").asLong(DEFAULT_TOKEN_TTL_SECONDS));
        } catch (RestClientException e) {
            throw translate("token request", e, null);
        }
    }

    @Override
    protected ExternalTransactionRef doInitiate(PaymentInitiation initiation) {
        String referenceId = UUID.randomUUID().toString();
        String token = accessToken();

        HttpHeaders headers = collectionHeaders(token);
        headers.set("X-Reference-Id", referenceId);
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.hasText(callbackUrl)) {
            headers.set("X-Callback-Url", callbackUrl);
        }

        Map<String, Object> payer = new LinkedHashMap<>();
        payer.put("partyIdType", "MSISDN");
        payer.put("partyId", initiation.getPhoneNumber());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", chargeableAmount(initiation.getAmount()).toPlainString());
        body.put("currency", SANDBOX_ENVIRONMENT.equals(targetEnvironment) ? SANDBOX_CURRENCY : initiation.getCurrency());
        body.put("externalId", initiation.getTransactionId());
        body.put("payer", payer);
        body.put("payerMessage", initiation.getDescription());
        body.put("payeeNote", initiation.getDescription());

        try {
            ResponseEntity<Void> response = restTemplate.exchange(
                    baseUrl + REQUEST_TO_PAY_PATH, HttpMethod.POST, new HttpEntity<>(body, headers), Void.class);
            if (response.getStatusCode().value() != HttpStatus.ACCEPTED.value()) {
                throw PaymentGatewayException.unknown(
                        "MTN answered request to pay with " + response.getStatusCode().value(), referenceId, null);
            }
        } catch (RestClientException e) {
            throw translate("request to pay", e, referenceId);
        }
        return new ExternalTransactionRef(referenceId);
    }

    @Override
    protected ProviderStatus doQueryStatus(String externalReference) {
        ResponseEntity<JsonNode> response = restTemplate.exchange(
                baseUrl + REQUEST_TO_PAY_PATH + "/" + externalReference, HttpMethod.GET,
                new HttpEntity<>(collectionHeaders(accessToken())), JsonNode.class);

        JsonNode body = response.getBody();
        if (body == null) {
            return ProviderStatus.UNKNOWN;
        }
        ProviderStatus status = ProviderStatusMapper.map(body.path("status").asText(null));
        if (status == ProviderStatus.FAILED && body.hasNonNull("reason")) {
            log.info("MTN payment failed: reference={}, reason={}", externalReference, body.get("reason").asText());
        }
        return status;
    }

    private HttpHeaders collectionHeaders(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.set("X-Target-Environment", targetEnvironment);
        headers.set(SUBSCRIPTION_KEY_HEADER, subscriptionKey);
        return headers;
    }
}
