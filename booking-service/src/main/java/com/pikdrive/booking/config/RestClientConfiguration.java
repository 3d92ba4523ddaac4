package com.pikdrive.booking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pikdrive.booking.enums.PaymentProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;

/**
 * One HTTP client per mobile money provider, so a slow provider can be given
 * its own timeouts without touching the other. The read timeout bounds how long
 * a provider call may take before its outcome is treated as unknown.
 */
@Configuration
public class RestClientConfiguration {

    @Bean
    public RestTemplate mtnRestTemplate(
            RestTemplateBuilder builder,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            @Value("${payment.providers.mtn.connect-timeout-ms:${http.client.connect-timeout-ms:5000}}") long connectTimeoutMs,
            @Value("${payment.providers.mtn.read-timeout-ms:${http.client.read-timeout-ms:10000}}") long readTimeoutMs) {
        return providerClient(builder, objectMapper, meterRegistry, PaymentProvider.MTN, connectTimeoutMs, readTimeoutMs);
    }

    @Bean
    public RestTemplate orangeRestTemplate(
            RestTemplateBuilder builder,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            @Value("${payment.providers.orange.connect-timeout-ms:${http.client.connect-timeout-ms:5000}}") long connectTimeoutMs,
            @Value("${payment.providers.orange.read-timeout-ms:${http.client.read-timeout-ms:10000}}") long readTimeoutMs) {
        return providerClient(builder, objectMapper, meterRegistry, PaymentProvider.ORANGE, connectTimeoutMs, readTimeoutMs);
    }

    static RestTemplate providerClient(RestTemplateBuilder builder, ObjectMapper objectMapper, MeterRegistry meterRegistry,
                                       PaymentProvider provider, long connectTimeoutMs, long readTimeoutMs) {
        MappingJackson2HttpMessageConverter converter = new MappingJackson2HttpMessageConverter();
        converter.setObjectMapper(objectMapper);

        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .additionalMessageConverters(converter)
                .additionalInterceptors(new ProviderCallInterceptor(provider, meterRegistry))
                .build();
    }

    /**
     * Times every provider call and logs its outcome. Bodies carry phone
     * numbers and credentials, so only the method, path and status are logged.
     */
    @Slf4j
    static class ProviderCallInterceptor implements ClientHttpRequestInterceptor {

        private final PaymentProvider provider;
        private final MeterRegistry meterRegistry;

        ProviderCallInterceptor(PaymentProvider provider, MeterRegistry meterRegistry) {
            this.provider = provider;
            this.meterRegistry = meterRegistry;
        }

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
                throws IOException {
            Timer.Sample sample = Timer.start(meterRegistry);
            String outcome = "io_error";
            try {
                ClientHttpResponse response = execution.execute(request, body);
                outcome = String.valueOf(response.getStatusCode().value());
                log.debug("Provider call: provider={}, method={}, path={}, status={}",
                        provider, request.getMethod(), request.getURI().getPath(), outcome);
                return response;
            } catch (IOException e) {
                log.warn("Provider call failed: provider={}, method={}, path={}, error={}",
                        provider, request.getMethod(), request.getURI().getPath(), e.getMessage());
                throw e;
            } finally {
                sample.stop(Timer.builder("payment.provider.http.duration")
                        .tag("provider", provider.name().toLowerCase())
                        .tag("status", outcome)
                        .register(meterRegistry));
            }
        }
    }
}
