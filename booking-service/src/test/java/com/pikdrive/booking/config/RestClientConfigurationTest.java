package com.pikdrive.booking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("RestClientConfiguration Unit Tests")
class RestClientConfigurationTest {

    private SimpleMeterRegistry meterRegistry;
    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        restTemplate = new RestClientConfiguration().orangeRestTemplate(
                new RestTemplateBuilder(), new ObjectMapper(), meterRegistry, 1000, 15000);
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    @Test
    @DisplayName("Each provider client carries its own call interceptor")
    void providerClient_HasCallInterceptor() {
        assertThat(restTemplate.getInterceptors())
                .singleElement()
                .isInstanceOf(RestClientConfiguration.ProviderCallInterceptor.class);
    }

    @Test
    @DisplayName("Provider calls are timed with provider and status")
    @SuppressWarnings("unchecked")
    void providerClient_TimesCalls() {
        server.expect(requestTo("https://orange.test/status/MP2401"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"status\":\"SUCCESSFULL\"}", MediaType.APPLICATION_JSON));

        Map<String, Object> body = restTemplate.getForObject("https://orange.test/status/MP2401", Map.class);

        assertThat(body).containsEntry("status", "SUCCESSFULL");
        Timer timer = meterRegistry.find("payment.provider.http.duration")
                .tags("provider", "orange", "status", "200")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        server.verify();
    }

    @Test
    @DisplayName("Provider errors are timed under their status code")
    void providerClient_TimesErrors() {
        server.expect(requestTo("https://orange.test/mp/pay"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> restTemplate.postForObject("https://orange.test/mp/pay", Map.of(), String.class))
                .isInstanceOf(HttpServerErrorException.class);

        assertThat(meterRegistry.find("payment.provider.http.duration")
                .tags("provider", "orange", "status", "500")
                .timer()).isNotNull();
    }

    @Test
    @DisplayName("Clients are built per provider")
    void mtnRestTemplate_TaggedWithMtn() {
        RestTemplate mtn = new RestClientConfiguration().mtnRestTemplate(
                new RestTemplateBuilder(), new ObjectMapper(), meterRegistry, 1000, 10000);
        MockRestServiceServer mtnServer = MockRestServiceServer.bindTo(mtn).build();
        mtnServer.expect(requestTo("https://mtn.test/collection/token/"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        mtn.postForObject("https://mtn.test/collection/token/", null, String.class);

        assertThat(meterRegistry.find("payment.provider.http.duration")
                .tags("provider", "mtn", "status", "200")
                .timer()).isNotNull();
    }
}
