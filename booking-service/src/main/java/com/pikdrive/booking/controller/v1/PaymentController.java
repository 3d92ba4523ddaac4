package com.pikdrive.booking.controller.v1;

import com.pikdrive.booking.dto.PaymentRequest;
import com.pikdrive.booking.dto.PaymentStatusEntry;
import com.pikdrive.booking.dto.PaymentTransactionEntry;
import com.pikdrive.booking.service.PaymentOrchestrator;
import com.pikdrive.booking.service.PaymentStatusPoller;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/bookings/{bookingId}/payment")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentOrchestrator paymentOrchestrator;
    private final PaymentStatusPoller statusPoller;

    /**
     * Sends a collection request to the rider's phone. Answers 202: the rider
     * still has to approve the payment.
     */
    @PostMapping
    public ResponseEntity<PaymentTransactionEntry> initiate(
            @PathVariable String bookingId,
            @Valid @RequestBody PaymentRequest request) {
        log.info("POST /v1/bookings/{}/payment - provider={}", bookingId, request.getProvider());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(paymentOrchestrator.initiatePayment(bookingId, request));
    }

    @GetMapping("/status")
    public ResponseEntity<PaymentStatusEntry> status(@PathVariable String bookingId) {
        log.debug("GET /v1/bookings/{}/payment/status", bookingId);
        return ResponseEntity.ok(paymentOrchestrator.getPaymentStatus(bookingId));
    }

    @DeleteMapping
    public ResponseEntity<PaymentStatusEntry> abandon(@PathVariable String bookingId) {
        log.info("DELETE /v1/bookings/{}/payment", bookingId);
        return ResponseEntity.ok(statusPoller.abandon(bookingId));
    }
}
