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
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Orange Money web payment API. A payment takes two calls: {@code mp/init}
 * hands out a pay token, {@code mp/pay} pushes the request to the subscriber.
 * The pay token is the reference for status queries.
 */
@Component
@Slf4j
public class OrangeMoneyGateway extends AbstractMobileMoneyGateway {

    private static final Pattern ORANGE_NUMBER = Pattern.compile("^6(9\\d|5[5-9])\\d{6}$");

    private static final String INIT_PATH = "mp/init";
    private static final String PAY_PATH = "mp/pay";
    private static final String STATUS_PATH = "mp/paymentstatus/";
    private static final String AUTH_TOKEN_HEADER = "X-AUTH-TOKEN";
    private static final long DEFAULT_TOKEN_TTL_SECONDS = 3600;

    private final String baseUrl;
    private final String tokenUrl;
    private final String consumerKey;
    private final String consumerSecret;
    private final String apiUsername;
    private final String apiPassword;
    private final String merchantNumber;
    private final String pin;
    private final String notificationUrl;

    public OrangeMoneyGateway(
            @Qualifier("orangeRestTemplate") RestTemplate restTemplate,
            @Value("${payment.providers.orange.base-url:https://api-s1.orange.cm/omcoreapis/1.0.2/}") String baseUrl,
            @Value("${payment.providers.orange.token-url:https://api-s1.orange.cm/token}") String tokenUrl,
            @Value("${payment.providers.orange.consumer-key:}") String consumerKey,
            @Value("${payment.providers.orange.consumer-secret:}") String consumerSecret,
            @Value("${payment.providers.orange.api-username:}") String apiUsername,
            @Value("${payment.providers.orange.api-password:}") String apiPassword,
            @Value("${payment.providers.orange.merchant-number:}") String merchantNumber,
            @Value("${payment.providers.orange.pin:}") String pin,
            @Value("${payment.providers.orange.notification-url:}") String notificationUrl,
            @Value("${payment.limits.min-amount:100}") BigDecimal minAmount,
            @Value("${payment.limits.max-amount:500000}") BigDecimal maxAmount) {
        super(restTemplate, minAmount, maxAmount);
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.tokenUrl = tokenUrl;
        this.consumerKey = consumerKey;
        this.consumerSecret = consumerSecret;
        this.apiUsername = apiUsername;
        this.apiPassword = apiPassword;
        this.merchantNumber = merchantNumber;
        this.pin = pin;
        this.notificationUrl = notificationUrl;
    }

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.ORANGE;
    }

    @Override
    protected Pattern nationalNumberPattern() {
        return ORANGE_NUMBER;
    }

    @Override
    protected AccessToken fetchAccessToken() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(consumerKey, consumerSecret);
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    tokenUrl, HttpMethod.POST, new HttpEntity<>(form, headers), JsonNode.class);
            JsonNode body = response.getBody();
            String token = body != null ? body.path("access_token").asText("") : "";
            if (!StringUtils.hasText(token)) {
                throw PaymentGatewayException.unknown("Orange token response had no access_token", null, null);
            }
            return new AccessToken(token, body.path("expires_in").asLong(DEFAULT_TOKEN_TTL_SECONDS));
        } catch (RestClientException e) {
            throw translate("token request", e, null);
        }
    }

    @Override
    protected ExternalTransactionRef doInitiate(PaymentInitiation initiation) {
        String amount = chargeableAmount(initiation.getAmount()).toPlainString();
        HttpHeaders headers = paymentHeaders(accessToken());

        String payToken;
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    baseUrl + INIT_PATH, HttpMethod.POST, new HttpEntity<>(headers), JsonNode.class);
            JsonNode body = response.getBody();
            payToken = body != null ? body.path("data").path("payToken").asText("") : "";
        } catch (RestClientException e) {
            throw translate("payment init", e, null);
        }
        if (!StringUtils.hasText(payToken)) {
            throw PaymentGatewayException.unknown("Orange init response had no payToken", null, null);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("notifUrl", notificationUrl);
        body.put("channelUserMsisdn", merchantNumber);
        body.put("amount", amount);
        body.put("subscriberMsisdn", initiation.getPhoneNumber());
        body.put("pin", pin);
        body.put("orderId", initiation.getTransactionId());
        body.put("description", sanitizeDescription(initiation.getDescription()));
        body.put("payToken", payToken);

        try {
            restTemplate.exchange(baseUrl + PAY_PATH, HttpMethod.POST, new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw translate("payment", e, payToken);
        }
        return new ExternalTransactionRef(payToken);
    }

    @Override
    protected ProviderStatus doQueryStatus(String externalReference) {
        ResponseEntity<JsonNode> response = restTemplate.exchange(
                baseUrl + STATUS_PATH + externalReference, HttpMethod.GET,
                new HttpEntity<>(paymentHeaders(accessToken())), JsonNode.class);

        JsonNode body = response.getBody();
        if (body == null) {
            return ProviderStatus.UNKNOWN;
        }
        return ProviderStatusMapper.map(body.path("data").path("status").asText(null));
    }

    private HttpHeaders paymentHeaders(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.set(AUTH_TOKEN_HEADER, Base64.getEncoder()
                .encodeToString((apiUsername + ":" + apiPassword).getBytes(StandardCharsets.UTF_8)));
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }

    private static String sanitizeDescription(String description) {
        return description == null ? "" : description.replaceAll("[^A-Za-z0-9 ]", "");
    }
}
