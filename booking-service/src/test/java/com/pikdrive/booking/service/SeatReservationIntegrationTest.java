package com.pikdrive.booking.service;

import com.pikdrive.booking.client.ExternalTransactionRef;
import com.pikdrive.booking.client.PaymentGateway;
import com.pikdrive.booking.client.PaymentGatewayRegistry;
import com.pikdrive.booking.dto.BookingEntry;
import com.pikdrive.booking.dto.BookingRequest;
import com.pikdrive.booking.dto.PaymentRequest;
import com.pikdrive.booking.dto.PaymentTransactionEntry;
import com.pikdrive.booking.enums.BookingPaymentStatus;
import com.pikdrive.booking.enums.PaymentProvider;
import com.pikdrive.booking.enums.TransactionStatus;
import com.pikdrive.booking.exception.BookingException;
import com.pikdrive.booking.exception.InsufficientCapacityException;
import com.pikdrive.booking.model.Booking;
import com.pikdrive.booking.model.PaymentTransaction;
import com.pikdrive.booking.model.Ride;
import com.pikdrive.booking.repository.BookingRepository;
import com.pikdrive.booking.repository.PaymentTransactionRepository;
import com.pikdrive.booking.repository.RideRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Runs the booking and payment services against a real database so the
 * conditional updates and unique active keys are exercised for real.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({RideInventoryService.class, BookingService.class, BookingVerificationService.class,
        PaymentOrchestrator.class, SeatReservationIntegrationTest.MetricsConfiguration.class})
@DisplayName("Seat Reservation Integration Tests")
class SeatReservationIntegrationTest {

    @TestConfiguration
    static class MetricsConfiguration {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private RideInventoryService inventoryService;

    @Autowired
    private BookingService bookingService;

    @Autowired
    private PaymentOrchestrator paymentOrchestrator;

    @Autowired
    private RideRepository rideRepository;

    @Autowired
    private BookingRepository bookingRepository;

    @Autowired
    private PaymentTransactionRepository transactionRepository;

    @MockBean
    private CacheService cacheService;

    @MockBean
    private PaymentGatewayRegistry gatewayRegistry;

    @AfterEach
    void tearDown() {
        transactionRepository.deleteAll();
        bookingRepository.deleteAll();
        rideRepository.deleteAll();
    }

    private Ride ride(String rideId, int totalSeats) {
        return rideRepository.save(Ride.builder()
                .rideId(rideId)
                .driverId("driver-1")
                .fromCity("Douala")
                .toCity("Yaounde")
                .departureTime(LocalDateTime.now().plusDays(1))
                .pricePerSeat(new BigDecimal("1500"))
                .totalSeats(totalSeats)
                .committedSeats(0)
                .build());
    }

    private int availableSeats(String rideId) {
        return rideRepository.findAvailableSeats(rideId).orElseThrow();
    }

    private static <T> List<Future<T>> runConcurrently(List<Callable<T>> tasks) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        try {
            for (Callable<T> task : tasks) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }
        return futures;
    }

    private PaymentGateway mtnGateway() {
        PaymentGateway gateway = mock(PaymentGateway.class);
        when(gatewayRegistry.resolveProvider("MTN")).thenReturn(PaymentProvider.MTN);
        when(gatewayRegistry.get(PaymentProvider.MTN)).thenReturn(gateway);
        when(gateway.provider()).thenReturn(PaymentProvider.MTN);
        when(gateway.normalizePhoneNumber(anyString())).thenReturn("237670000001");
        when(gateway.chargeableAmount(any())).thenAnswer(inv -> inv.getArgument(0));
        when(gateway.initiate(any())).thenReturn(new ExternalTransactionRef("mtn-ref-1"));
        return gateway;
    }

    private static PaymentRequest mtnRequest() {
        return PaymentRequest.builder().provider("MTN").phoneNumber("670000001").build();
    }

    private static String errorCode(ExecutionException e) {
        assertThat(e.getCause()).isInstanceOf(BookingException.class);
        return ((BookingException) e.getCause()).getErrorCode();
    }

    @Test
    @DisplayName("Concurrent reservations never exceed the ride's capacity")
    void reserve_Concurrent_NeverOversells() throws Exception {
        ride("RD-CONCURRENT", 4);

        List<Callable<Boolean>> tasks = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            tasks.add(() -> {
                try {
                    inventoryService.reserve("RD-CONCURRENT", 1);
                    return true;
                } catch (InsufficientCapacityException e) {
                    return false;
                }
            });
        }

        int reserved = 0;
        for (Future<Boolean> future : runConcurrently(tasks)) {
            if (future.get()) {
                reserved++;
            }
        }

        assertThat(reserved).isEqualTo(4);
        assertThat(availableSeats("RD-CONCURRENT")).isZero();
    }

    @Test
    @DisplayName("Two riders racing for the last seat: exactly one gets it")
    void createOrUpdateBooking_LastSeatRace_OneWinner() throws Exception {
        ride("RD-LAST-SEAT", 1);

        List<Callable<BookingEntry>> tasks = List.of(
                () -> bookingService.createOrUpdateBooking(new BookingRequest("RD-LAST-SEAT", "rider-a", 1)),
                () -> bookingService.createOrUpdateBooking(new BookingRequest("RD-LAST-SEAT", "rider-b", 1)));

        int winners = 0;
        int losers = 0;
        for (Future<BookingEntry> future : runConcurrently(tasks)) {
            try {
                future.get();
                winners++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(InsufficientCapacityException.class);
                losers++;
            }
        }

        assertThat(winners).isEqualTo(1);
        assertThat(losers).isEqualTo(1);
        assertThat(availableSeats("RD-LAST-SEAT")).isZero();
        assertThat(bookingRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Same rider twice on one ride keeps a single live booking")
    void createOrUpdateBooking_SameRiderTwice_SingleBooking() {
        ride("RD-SINGLE", 4);

        BookingEntry first = bookingService.createOrUpdateBooking(new BookingRequest("RD-SINGLE", "rider-a", 2));
        BookingEntry second = bookingService.createOrUpdateBooking(new BookingRequest("RD-SINGLE", "rider-a", 3));

        assertThat(second.getBookingId()).isEqualTo(first.getBookingId());
        assertThat(second.getSeats()).isEqualTo(3);
        assertThat(availableSeats("RD-SINGLE")).isEqualTo(1);
        assertThat(bookingRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("A failed payment returns its seats once, however often it is reconciled")
    void reconcile_Repeated_ReleasesOnce() {
        ride("RD-RECONCILE", 3);
        BookingEntry entry = bookingService.createOrUpdateBooking(new BookingRequest("RD-RECONCILE", "rider-a", 2));
        PaymentTransaction transaction = pendingPayment(entry.getBookingId(), 2);

        boolean first = paymentOrchestrator.reconcile(transaction.getTransactionId(), TransactionStatus.FAILED);
        boolean second = paymentOrchestrator.reconcile(transaction.getTransactionId(), TransactionStatus.EXPIRED);
        boolean third = paymentOrchestrator.reconcile(transaction.getTransactionId(), TransactionStatus.SUCCEEDED);

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(third).isFalse();
        assertThat(availableSeats("RD-RECONCILE")).isEqualTo(3);

        Booking booking = bookingRepository.findById(entry.getBookingId()).orElseThrow();
        assertThat(booking.getPaymentStatus()).isEqualTo(BookingPaymentStatus.FAILED);
        assertThat(transactionRepository.findById(transaction.getTransactionId()).orElseThrow().getStatus())
                .isEqualTo(TransactionStatus.FAILED);
    }

    @Test
    @DisplayName("Paid booking can grow and only the new seats are reserved")
    void reconcile_SuccessThenTopUp_ReservesDelta() {
        ride("RD-TOPUP", 4);
        BookingEntry entry = bookingService.createOrUpdateBooking(new BookingRequest("RD-TOPUP", "rider-a", 2));
        PaymentTransaction transaction = pendingPayment(entry.getBookingId(), 2);

        assertThat(paymentOrchestrator.reconcile(transaction.getTransactionId(), TransactionStatus.SUCCEEDED)).isTrue();

        Booking paid = bookingRepository.findById(entry.getBookingId()).orElseThrow();
        assertThat(paid.getPaymentStatus()).isEqualTo(BookingPaymentStatus.COMPLETED);
        assertThat(paid.getPaidSeats()).isEqualTo(2);
        assertThat(paid.getVerificationCode()).hasSize(6);

        BookingEntry topUp = bookingService.createOrUpdateBooking(new BookingRequest("RD-TOPUP", "rider-a", 3));

        assertThat(topUp.getPaymentStatus()).isEqualTo("AWAITING_PAYMENT");
        assertThat(topUp.getUnpaidSeats()).isEqualTo(1);
        assertThat(availableSeats("RD-TOPUP")).isEqualTo(1);
    }

    @Test
    @DisplayName("Resize racing a payment claim is refused and the charged seats are all the booking holds")
    void createOrUpdateBooking_ResizeDuringPaymentClaim_Refused() throws Exception {
        ride("RD-RESIZE", 5);
        BookingEntry entry = bookingService.createOrUpdateBooking(new BookingRequest("RD-RESIZE", "rider-a", 2));

        PaymentGateway gateway = mtnGateway();
        CountDownLatch claimed = new CountDownLatch(1);
        CountDownLatch resized = new CountDownLatch(1);
        when(gateway.initiate(any())).thenAnswer(inv -> {
            claimed.countDown();
            assertThat(resized.await(30, TimeUnit.SECONDS)).isTrue();
            return new ExternalTransactionRef("mtn-ref-resize");
        });

        // the resize has reserved its extra seats but not yet written the booking
        ExecutorService executor = Executors.newSingleThreadExecutor();
        AtomicBoolean armed = new AtomicBoolean(true);
        List<Future<PaymentTransactionEntry>> payment = new ArrayList<>();
        doAnswer(inv -> {
            if (armed.getAndSet(false)) {
                payment.add(executor.submit(() -> paymentOrchestrator.initiatePayment(entry.getBookingId(), mtnRequest())));
                assertThat(claimed.await(30, TimeUnit.SECONDS)).isTrue();
            }
            return null;
        }).when(cacheService).evictAvailableSeatsAfterCommit("RD-RESIZE");

        try {
            assertThatThrownBy(() -> bookingService.createOrUpdateBooking(new BookingRequest("RD-RESIZE", "rider-a", 4)))
                    .isInstanceOf(BookingException.class)
                    .hasFieldOrPropertyWithValue("errorCode", BookingException.TRANSACTION_ALREADY_IN_PROGRESS);
        } finally {
            resized.countDown();
            executor.shutdown();
        }

        PaymentTransactionEntry pending = payment.get(0).get(30, TimeUnit.SECONDS);
        assertThat(pending.getSeatCount()).isEqualTo(2);
        assertThat(bookingRepository.findById(entry.getBookingId()).orElseThrow().getSeats()).isEqualTo(2);
        assertThat(availableSeats("RD-RESIZE")).isEqualTo(3);

        assertThat(paymentOrchestrator.reconcile(pending.getTransactionId(), TransactionStatus.SUCCEEDED)).isTrue();

        Booking paid = bookingRepository.findById(entry.getBookingId()).orElseThrow();
        assertThat(paid.getPaymentStatus()).isEqualTo(BookingPaymentStatus.COMPLETED);
        assertThat(paid.getPaidSeats()).isEqualTo(paid.getSeats()).isEqualTo(2);
        assertThat(availableSeats("RD-RESIZE")).isEqualTo(3);
    }

    @Test
    @DisplayName("Two payment attempts racing on one booking open a single transaction")
    void initiatePayment_Concurrent_SingleTransaction() throws Exception {
        ride("RD-PAY-RACE", 4);
        BookingEntry entry = bookingService.createOrUpdateBooking(new BookingRequest("RD-PAY-RACE", "rider-a", 2));
        mtnGateway();

        List<Callable<PaymentTransactionEntry>> tasks = List.of(
                () -> paymentOrchestrator.initiatePayment(entry.getBookingId(), mtnRequest()),
                () -> paymentOrchestrator.initiatePayment(entry.getBookingId(), mtnRequest()));

        int started = 0;
        for (Future<PaymentTransactionEntry> future : runConcurrently(tasks)) {
            try {
                assertThat(future.get().getStatus()).isEqualTo("PENDING");
                started++;
            } catch (ExecutionException e) {
                assertThat(errorCode(e)).isEqualTo(BookingException.TRANSACTION_ALREADY_IN_PROGRESS);
            }
        }

        assertThat(started).isEqualTo(1);
        assertThat(transactionRepository.findAll())
                .filteredOn(t -> t.getBookingId().equals(entry.getBookingId()))
                .hasSize(1);
        assertThat(bookingRepository.findById(entry.getBookingId()).orElseThrow().getPaymentStatus())
                .isEqualTo(BookingPaymentStatus.PAYMENT_IN_PROGRESS);
    }

    @Test
    @DisplayName("Same rider booking twice at once ends with one booking holding the requested seats")
    void createOrUpdateBooking_SameRiderConcurrent_SingleBooking() throws Exception {
        ride("RD-SAME-RIDER", 4);

        List<Callable<BookingEntry>> tasks = List.of(
                () -> bookingService.createOrUpdateBooking(new BookingRequest("RD-SAME-RIDER", "rider-a", 2)),
                () -> bookingService.createOrUpdateBooking(new BookingRequest("RD-SAME-RIDER", "rider-a", 2)));

        List<String> bookingIds = new ArrayList<>();
        for (Future<BookingEntry> future : runConcurrently(tasks)) {
            BookingEntry booking = future.get();
            assertThat(booking.getSeats()).isEqualTo(2);
            bookingIds.add(booking.getBookingId());
        }

        assertThat(bookingIds).hasSize(2).containsOnly(bookingIds.get(0));
        assertThat(bookingRepository.count()).isEqualTo(1);
        assertThat(availableSeats("RD-SAME-RIDER")).isEqualTo(2);
    }

    private PaymentTransaction pendingPayment(String bookingId, int seats) {
        Booking booking = bookingRepository.findById(bookingId).orElseThrow();
        booking.setPaymentStatus(BookingPaymentStatus.PAYMENT_IN_PROGRESS);
        bookingRepository.save(booking);

        return transactionRepository.save(PaymentTransaction.builder()
                .transactionId("PT-" + bookingId)
                .bookingId(bookingId)
                .provider(PaymentProvider.MTN)
                .amount(new BigDecimal("1500").multiply(BigDecimal.valueOf(seats)))
                .currency("XAF")
                .phoneNumber("237670000001")
                .seatCount(seats)
                .externalReference("mtn-" + bookingId)
                .status(TransactionStatus.PENDING)
                .activeBookingId(bookingId)
                .build());
    }
}
