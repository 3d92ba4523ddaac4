package com.pikdrive.booking.controller.v1;

import com.pikdrive.booking.constants.PaymentConstants;
import com.pikdrive.booking.service.PaymentWebhookService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/v1/payments/webhooks")
@RequiredArgsConstructor
@Slf4j
public class PaymentWebhookController {

    private final PaymentWebhookService webhookService;

    @PostMapping("/{provider}")
    public ResponseEntity<Map<String, String>> receive(
            @PathVariable String provider,
            @RequestHeader(value = PaymentConstants.SIGNATURE_HEADER, required = false) String signature,
            @RequestBody String payload) {
        log.info("POST /v1/payments/webhooks/{}", provider);
        String result = webhookService.handleNotification(provider, payload, signature);
        return ResponseEntity.ok(Map.of("status", result));
    }
}
