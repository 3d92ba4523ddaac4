package com.pikdrive.booking.controller.v1;

import com.pikdrive.booking.dto.BookingEntry;
import com.pikdrive.booking.dto.BookingRequest;
import com.pikdrive.booking.dto.VerificationCodeRequest;
import com.pikdrive.booking.dto.VerificationResult;
import com.pikdrive.booking.service.BookingService;
import com.pikdrive.booking.service.BookingVerificationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/bookings")
@RequiredArgsConstructor
@Slf4j
public class BookingController {

    private final BookingService bookingService;
    private final BookingVerificationService verificationService;

    /**
     * Creates the rider's booking on the ride or moves it to the requested seat total.
     */
    @PostMapping
    public ResponseEntity<BookingEntry> createOrUpdate(@Valid @RequestBody BookingRequest request) {
        log.info("POST /v1/bookings - ride={}, rider={}, seats={}",
                request.getRideId(), request.getRiderId(), request.getSeats());
        return ResponseEntity.ok(bookingService.createOrUpdateBooking(request));
    }

    @GetMapping("/{bookingId}")
    public ResponseEntity<BookingEntry> findById(@PathVariable String bookingId) {
        log.debug("GET /v1/bookings/{}", bookingId);
        return ResponseEntity.ok(bookingService.findById(bookingId));
    }

    @GetMapping("/rider/{riderId}")
    public ResponseEntity<List<BookingEntry>> findByRider(@PathVariable String riderId) {
        log.debug("GET /v1/bookings/rider/{}", riderId);
        return ResponseEntity.ok(bookingService.findByRiderId(riderId));
    }

    @DeleteMapping("/{bookingId}")
    public ResponseEntity<BookingEntry> cancel(@PathVariable String bookingId) {
        log.info("DELETE /v1/bookings/{}", bookingId);
        return ResponseEntity.ok(bookingService.cancelBooking(bookingId));
    }

    @PostMapping("/{bookingId}/verify-code")
    public ResponseEntity<VerificationResult> verifyCode(
            @PathVariable String bookingId,
            @Valid @RequestBody VerificationCodeRequest request) {
        log.info("POST /v1/bookings/{}/verify-code", bookingId);
        return ResponseEntity.ok(verificationService.verifyCode(bookingId, request.getCode()));
    }
}
