package com.pikdrive.booking.client;

import com.pikdrive.booking.enums.ProviderStatus;
import com.pikdrive.booking.exception.PaymentGatewayException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("MtnMomoGateway Unit Tests")
class MtnMomoGatewayTest {

    private static final String BASE_URL = "https://momo.test";
    private static final String TOKEN_JSON = "{\"access_token\":\"token-1\",\"token_type\":\"access_token\",\"expires_in\":3600}";

    private MockRestServiceServer server;
    private MtnMomoGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        gateway = gateway(restTemplate, "mtncameroon");
    }

    private static MtnMomoGateway gateway(RestTemplate restTemplate, String environment) {
        return new MtnMomoGateway(restTemplate, BASE_URL, "sub-key", "api-user", "api-key", environment,
                "", new BigDecimal("100"), new BigDecimal("500000"));
    }

    private static PaymentInitiation initiation() {
        return PaymentInitiation.builder()
                .transactionId("PT000000000001")
                .amount(new BigDecimal("3000.00"))
                .currency("XAF")
                .phoneNumber("237670000001")
                .description("Ride booking BK000000000001")
                .build();
    }

    private void expectToken() {
        server.expect(once(), requestTo(BASE_URL + "/collection/token/"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Ocp-Apim-Subscription-Key", "sub-key"))
                .andRespond(withSuccess(TOKEN_JSON, MediaType.APPLICATION_JSON));
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Accepts MTN numbers in any common notation")
        void normalizePhoneNumber_MtnNumber_ReturnsInternational() {
            assertThat(gateway.normalizePhoneNumber("+237 670 000 001")).isEqualTo("237670000001");
            assertThat(gateway.normalizePhoneNumber("653123456")).isEqualTo("237653123456");
        }

        @Test
        @DisplayName("Rejects Orange numbers")
        void normalizePhoneNumber_OrangeNumber_Throws() {
            assertThatThrownBy(() -> gateway.normalizePhoneNumber("690000001"))
                    .isInstanceOf(PaymentGatewayException.class)
                    .hasFieldOrPropertyWithValue("errorCode", PaymentGatewayException.INVALID_PHONE_NUMBER);
        }

        @Test
        @DisplayName("Rounds to whole francs and enforces limits")
        void chargeableAmount_RoundsAndChecksLimits() {
            assertThat(gateway.chargeableAmount(new BigDecimal("1500.50"))).isEqualByComparingTo("1501");
            assertThatThrownBy(() -> gateway.chargeableAmount(new BigDecimal("50")))
                    .isInstanceOf(PaymentGatewayException.class)
                    .hasFieldOrPropertyWithValue("errorCode", PaymentGatewayException.AMOUNT_OUT_OF_RANGE);
        }
    }

    @Nested
    @DisplayName("Request To Pay")
    class InitiateTests {

        @Test
        @DisplayName("Sends the request to pay and returns the reference id")
        void initiate_Accepted_ReturnsReference() {
            expectToken();
            server.expect(once(), requestTo(BASE_URL + "/collection/v1_0/requesttopay"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header("Authorization", "Bearer token-1"))
                    .andExpect(header("X-Target-Environment", "mtncameroon"))
                    .andExpect(jsonPath("$.amount").value("3000"))
                    .andExpect(jsonPath("$.currency").value("XAF"))
                    .andExpect(jsonPath("$.externalId").value("PT000000000001"))
                    .andExpect(jsonPath("$.payer.partyId").value("237670000001"))
                    .andRespond(withStatus(HttpStatus.ACCEPTED));

            ExternalTransactionRef ref = gateway.initiate(initiation());

            assertThat(ref.getReference()).isNotBlank();
            server.verify();
        }

        @Test
        @DisplayName("Sandbox charges in EUR")
        void initiate_Sandbox_UsesEur() {
            RestTemplate restTemplate = new RestTemplate();
            server = MockRestServiceServer.bindTo(restTemplate).build();
            MtnMomoGateway sandbox = gateway(restTemplate, "sandbox");

            expectToken();
            server.expect(once(), requestTo(BASE_URL + "/collection/v1_0/requesttopay"))
                    .andExpect(jsonPath("$.currency").value("EUR"))
                    .andRespond(withStatus(HttpStatus.ACCEPTED));

            sandbox.initiate(initiation());

            server.verify();
        }

        @Test
        @DisplayName("Client error is a rejection")
        void initiate_BadRequest_Rejected() {
            expectToken();
            server.expect(once(), requestTo(BASE_URL + "/collection/v1_0/requesttopay"))
                    .andRespond(withBadRequest());

            assertThatThrownBy(() -> gateway.initiate(initiation()))
                    .isInstanceOfSatisfying(PaymentGatewayException.class,
                            e -> assertThat(e.isRejection()).isTrue());
        }

        @Test
        @DisplayName("Read timeout leaves the outcome unknown and keeps the reference")
        void initiate_Timeout_OutcomeUnknown() {
            expectToken();
            server.expect(once(), requestTo(BASE_URL + "/collection/v1_0/requesttopay"))
                    .andRespond(withException(new SocketTimeoutException("Read timed out")));

            assertThatThrownBy(() -> gateway.initiate(initiation()))
                    .isInstanceOfSatisfying(PaymentGatewayException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(PaymentGatewayException.PAYMENT_TIMEOUT);
                        assertThat(e.isOutcomeUnknown()).isTrue();
                        assertThat(e.getExternalReference()).isNotBlank();
                    });
        }
    }

    @Nested
    @DisplayName("Status Query")
    class QueryStatusTests {

        @Test
        @DisplayName("Maps provider status and reuses the access token")
        void queryStatus_MapsStatusAndCachesToken() {
            expectToken();
            server.expect(once(), requestTo(BASE_URL + "/collection/v1_0/requesttopay/ref-1"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("{\"status\":\"PENDING\"}", MediaType.APPLICATION_JSON));
            server.expect(once(), requestTo(BASE_URL + "/collection/v1_0/requesttopay/ref-1"))
                    .andRespond(withSuccess("{\"status\":\"SUCCESSFUL\",\"financialTransactionId\":\"123\"}",
                            MediaType.APPLICATION_JSON));

            assertThat(gateway.queryStatus("ref-1")).isEqualTo(ProviderStatus.PENDING);
            assertThat(gateway.queryStatus("ref-1")).isEqualTo(ProviderStatus.SUCCEEDED);
            server.verify();
        }

        @Test
        @DisplayName("Failed status query reads as unknown")
        void queryStatus_ServerError_Unknown() {
            expectToken();
            server.expect(times(1), requestTo(BASE_URL + "/collection/v1_0/requesttopay/ref-1"))
                    .andRespond(withServerError());

            assertThat(gateway.queryStatus("ref-1")).isEqualTo(ProviderStatus.UNKNOWN);
        }
    }
}
