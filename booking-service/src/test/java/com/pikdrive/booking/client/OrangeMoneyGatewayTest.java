package com.pikdrive.booking.client;

import com.pikdrive.booking.enums.ProviderStatus;
import com.pikdrive.booking.exception.PaymentGatewayException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("OrangeMoneyGateway Unit Tests")
class OrangeMoneyGatewayTest {

    private static final String BASE_URL = "https://orange.test/omcoreapis/1.0.2";
    private static final String TOKEN_URL = "https://orange.test/token";

    private MockRestServiceServer server;
    private OrangeMoneyGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        gateway = new OrangeMoneyGateway(restTemplate, BASE_URL, TOKEN_URL, "consumer-key", "consumer-secret",
                "api-user", "api-password", "699000000", "1234", "https://pikdrive.test/v1/payments/webhooks/orange",
                new BigDecimal("100"), new BigDecimal("500000"));
    }

    private static PaymentInitiation initiation() {
        return PaymentInitiation.builder()
                .transactionId("PT000000000002")
                .amount(new BigDecimal("4500"))
                .currency("XAF")
                .phoneNumber("237690000001")
                .description("Ride booking BK-000000000002")
                .build();
    }

    private void expectToken() {
        server.expect(once(), requestTo(TOKEN_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string(containsString("grant_type=client_credentials")))
                .andRespond(withSuccess("{\"access_token\":\"orange-token\",\"expires_in\":3600}",
                        MediaType.APPLICATION_JSON));
    }

    @Test
    @DisplayName("Accepts Orange numbers and rejects MTN numbers")
    void normalizePhoneNumber_ChecksPrefix() {
        assertThat(gateway.normalizePhoneNumber("655 123 456")).isEqualTo("237655123456");
        assertThatThrownBy(() -> gateway.normalizePhoneNumber("670000001"))
                .isInstanceOf(PaymentGatewayException.class)
                .hasFieldOrPropertyWithValue("errorCode", PaymentGatewayException.INVALID_PHONE_NUMBER);
    }

    @Test
    @DisplayName("Init then pay, pay token becomes the reference")
    void initiate_InitAndPay_ReturnsPayToken() {
        expectToken();
        server.expect(once(), requestTo(BASE_URL + "/mp/init"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer orange-token"))
                .andExpect(header("X-AUTH-TOKEN", "YXBpLXVzZXI6YXBpLXBhc3N3b3Jk"))
                .andRespond(withSuccess("{\"message\":\"Payment request successfully initiated\",\"data\":{\"payToken\":\"MP2401\"}}",
                        MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(BASE_URL + "/mp/pay"))
                .andExpect(jsonPath("$.payToken").value("MP2401"))
                .andExpect(jsonPath("$.amount").value("4500"))
                .andExpect(jsonPath("$.subscriberMsisdn").value("237690000001"))
                .andExpect(jsonPath("$.orderId").value("PT000000000002"))
                .andExpect(jsonPath("$.description").value("Ride booking BK000000000002"))
                .andRespond(withSuccess("{\"data\":{\"status\":\"PENDING\"}}", MediaType.APPLICATION_JSON));

        ExternalTransactionRef ref = gateway.initiate(initiation());

        assertThat(ref.getReference()).isEqualTo("MP2401");
        server.verify();
    }

    @Test
    @DisplayName("Timeout on pay keeps the pay token for polling")
    void initiate_PayTimeout_KeepsPayToken() {
        expectToken();
        server.expect(once(), requestTo(BASE_URL + "/mp/init"))
                .andRespond(withSuccess("{\"data\":{\"payToken\":\"MP2402\"}}", MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(BASE_URL + "/mp/pay"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> gateway.initiate(initiation()))
                .isInstanceOfSatisfying(PaymentGatewayException.class, e -> {
                    assertThat(e.isOutcomeUnknown()).isTrue();
                    assertThat(e.getExternalReference()).isEqualTo("MP2402");
                });
    }

    @Test
    @DisplayName("Status is read from data.status")
    void queryStatus_Successfull_Succeeded() {
        expectToken();
        server.expect(once(), requestTo(BASE_URL + "/mp/paymentstatus/MP2401"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"data\":{\"status\":\"SUCCESSFULL\"}}", MediaType.APPLICATION_JSON));

        assertThat(gateway.queryStatus("MP2401")).isEqualTo(ProviderStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("Rejected credentials drop the cached token")
    void queryStatus_Unauthorized_RefetchesToken() {
        expectToken();
        server.expect(once(), requestTo(BASE_URL + "/mp/paymentstatus/MP2401"))
                .andRespond(withUnauthorizedRequest());
        expectToken();
        server.expect(once(), requestTo(BASE_URL + "/mp/paymentstatus/MP2401"))
                .andRespond(withSuccess("{\"data\":{\"status\":\"FAILED\"}}", MediaType.APPLICATION_JSON));

        assertThat(gateway.queryStatus("MP2401")).isEqualTo(ProviderStatus.UNKNOWN);
        assertThat(gateway.queryStatus("MP2401")).isEqualTo(ProviderStatus.FAILED);
        server.verify();
    }
}
