package com.pikdrive.booking.client;

import com.pikdrive.booking.enums.PaymentProvider;
import com.pikdrive.booking.exception.PaymentGatewayException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class PaymentGatewayRegistry {

    private final Map<PaymentProvider, PaymentGateway> gateways = new EnumMap<>(PaymentProvider.class);

    public PaymentGatewayRegistry(List<PaymentGateway> gateways) {
        for (PaymentGateway gateway : gateways) {
            this.gateways.put(gateway.provider(), gateway);
        }
    }

    public PaymentGateway get(PaymentProvider provider) {
        PaymentGateway gateway = gateways.get(provider);
        if (gateway == null) {
            throw PaymentGatewayException.unsupportedProvider(String.valueOf(provider));
        }
        return gateway;
    }

    public PaymentProvider resolveProvider(String code) {
        return PaymentProvider.fromCode(code)
                .orElseThrow(() -> PaymentGatewayException.unsupportedProvider(code));
    }
}
