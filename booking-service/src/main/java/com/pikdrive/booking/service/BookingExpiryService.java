package com.pikdrive.booking.service;

import com.pikdrive.booking.constants.BookingConstants;
import com.pikdrive.booking.constants.PaymentConstants;
import com.pikdrive.booking.enums.BookingPaymentStatus;
import com.pikdrive.booking.enums.TransactionStatus;
import com.pikdrive.booking.model.Booking;
import com.pikdrive.booking.model.PaymentTransaction;
import com.pikdrive.booking.repository.BookingRepository;
import com.pikdrive.booking.repository.PaymentTransactionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Returns seats held by bookings that sat unpaid longer than the reservation TTL.
 * Each booking is handled in its own transaction.
 */
@Service
@Slf4j
public class BookingExpiryService {

    private final BookingRepository bookingRepository;
    private final PaymentTransactionRepository transactionRepository;
    private final BookingService bookingService;
    private final PaymentStatusPoller statusPoller;
    private final MeterRegistry meterRegistry;

    private final int reservationTtlMinutes;

    public BookingExpiryService(
            BookingRepository bookingRepository,
            PaymentTransactionRepository transactionRepository,
            BookingService bookingService,
            PaymentStatusPoller statusPoller,
            MeterRegistry meterRegistry,
            @Value("${booking.reservation-ttl-minutes:" + BookingConstants.DEFAULT_RESERVATION_TTL_MINUTES + "}") int reservationTtlMinutes) {
        this.bookingRepository = bookingRepository;
        this.transactionRepository = transactionRepository;
        this.bookingService = bookingService;
        this.statusPoller = statusPoller;
        this.meterRegistry = meterRegistry;
        this.reservationTtlMinutes = reservationTtlMinutes;
    }

    @Scheduled(fixedDelayString = "${booking.expiry-check-interval-ms:" + BookingConstants.DEFAULT_EXPIRY_CHECK_INTERVAL_MS + "}")
    public void processExpiredReservations() {
        LocalDateTime cutoff = LocalDateTime.now().minus(reservationTtlMinutes, ChronoUnit.MINUTES);

        List<Booking> awaiting = bookingRepository
                .findByPaymentStatusAndUpdatedAtBefore(BookingPaymentStatus.AWAITING_PAYMENT, cutoff);
        List<Booking> inProgress = bookingRepository
                .findByPaymentStatusAndUpdatedAtBefore(BookingPaymentStatus.PAYMENT_IN_PROGRESS, cutoff);

        if (awaiting.isEmpty() && inProgress.isEmpty()) {
            return;
        }

        log.info("Processing expired reservations: awaiting={}, inProgress={}", awaiting.size(), inProgress.size());
        awaiting.forEach(this::processExpiredBooking);
        inProgress.forEach(this::processExpiredBooking);
    }

    private void processExpiredBooking(Booking booking) {
        try {
            Optional<PaymentTransaction> active = transactionRepository.findByActiveBookingId(booking.getBookingId());
            boolean expired;
            if (active.isPresent()) {
                expired = statusPoller.resolve(active.get().getTransactionId(),
                        TransactionStatus.EXPIRED, PaymentConstants.REASON_RESERVATION_EXPIRED);
            } else {
                expired = bookingService.expireReservation(booking.getBookingId());
            }

            meterRegistry.counter("booking.expiry.total", "result", expired ? "expired" : "skipped").increment();
            log.info("Expired reservation processed: id={}, seats={}, expired={}",
                    booking.getBookingId(), booking.getSeats(), expired);

        } catch (Exception e) {
            meterRegistry.counter("booking.expiry.total", "result", "error").increment();
            log.error("Error processing expired reservation {}: {}", booking.getBookingId(), e.getMessage(), e);
        }
    }
}
