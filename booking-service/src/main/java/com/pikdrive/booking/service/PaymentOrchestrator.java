package com.pikdrive.booking.service;

import com.pikdrive.booking.client.ExternalTransactionRef;
import com.pikdrive.booking.client.PaymentGateway;
import com.pikdrive.booking.client.PaymentGatewayRegistry;
import com.pikdrive.booking.client.PaymentInitiation;
import com.pikdrive.booking.constants.PaymentConstants;
import com.pikdrive.booking.dto.PaymentRequest;
import com.pikdrive.booking.dto.PaymentStatusEntry;
import com.pikdrive.booking.dto.PaymentTransactionEntry;
import com.pikdrive.booking.dto.ReservationToken;
import com.pikdrive.booking.enums.BookingPaymentStatus;
import com.pikdrive.booking.enums.PaymentProvider;
import com.pikdrive.booking.enums.TransactionStatus;
import com.pikdrive.booking.event.PaymentPendingEvent;
import com.pikdrive.booking.exception.BookingException;
import com.pikdrive.booking.exception.BookingNotFoundException;
import com.pikdrive.booking.exception.PaymentGatewayException;
import com.pikdrive.booking.exception.PaymentTransactionNotFoundException;
import com.pikdrive.booking.exception.RideNotFoundException;
import com.pikdrive.booking.mapper.PaymentMapper;
import com.pikdrive.booking.model.Booking;
import com.pikdrive.booking.model.PaymentTransaction;
import com.pikdrive.booking.model.Ride;
import com.pikdrive.booking.repository.BookingRepository;
import com.pikdrive.booking.repository.PaymentTransactionRepository;
import com.pikdrive.booking.repository.RideRepository;
import com.pikdrive.booking.util.IdGenerator;
import com.pikdrive.booking.util.PhoneNumbers;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Charges bookings for their unpaid seats and applies the final outcome of each
 * payment transaction.
 * <p>
 * Initiation never holds a database transaction across the provider call: the
 * transaction row is claimed first, the provider is called, then the result is
 * recorded. {@link #reconcile} is the only place a transaction turns terminal,
 * and the terminal transition is a conditional update, so a second reconcile of
 * the same transaction changes nothing.
 */
@Service
@Slf4j
public class PaymentOrchestrator {

    private final BookingRepository bookingRepository;
    private final PaymentTransactionRepository transactionRepository;
    private final RideRepository rideRepository;
    private final RideInventoryService inventoryService;
    private final BookingService bookingService;
    private final BookingVerificationService verificationService;
    private final PaymentGatewayRegistry gatewayRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final TransactionTemplate transactionTemplate;

    private final String currency;

    public PaymentOrchestrator(
            BookingRepository bookingRepository,
            PaymentTransactionRepository transactionRepository,
            RideRepository rideRepository,
            RideInventoryService inventoryService,
            BookingService bookingService,
            BookingVerificationService verificationService,
            PaymentGatewayRegistry gatewayRegistry,
            ApplicationEventPublisher eventPublisher,
            MeterRegistry meterRegistry,
            PlatformTransactionManager transactionManager,
            @Value("${payment.currency:" + PaymentConstants.DEFAULT_CURRENCY + "}") String currency) {
        this.bookingRepository = bookingRepository;
        this.transactionRepository = transactionRepository;
        this.rideRepository = rideRepository;
        this.inventoryService = inventoryService;
        this.bookingService = bookingService;
        this.verificationService = verificationService;
        this.gatewayRegistry = gatewayRegistry;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.currency = currency;
    }

    /**
     * Starts collecting the unpaid seats of a booking.
     *
     * @return the transaction, {@code PENDING} until the provider reports a final status
     */
    public PaymentTransactionEntry initiatePayment(String bookingId, PaymentRequest request) {
        PaymentProvider provider = gatewayRegistry.resolveProvider(request.getProvider());
        PaymentGateway gateway = gatewayRegistry.get(provider);
        String phoneNumber = gateway.normalizePhoneNumber(request.getPhoneNumber());

        log.info("Initiating payment: bookingId={}, provider={}, phone={}",
                bookingId, provider, PhoneNumbers.mask(phoneNumber));

        PaymentTransaction transaction = claimTransaction(bookingId, gateway, phoneNumber);

        String reference;
        String note = null;
        try {
            ExternalTransactionRef ref = gateway.initiate(PaymentInitiation.builder()
                    .transactionId(transaction.getTransactionId())
                    .amount(transaction.getAmount())
                    .currency(transaction.getCurrency())
                    .phoneNumber(phoneNumber)
                    .description("Ride booking " + bookingId)
                    .build());
            reference = ref.getReference();
        } catch (PaymentGatewayException e) {
            if (!e.isOutcomeUnknown()) {
                meterRegistry.counter("payment.initiate.total", "result", "rejected").increment();
                log.warn("Payment rejected by provider: bookingId={}, transactionId={}, code={}, reason={}",
                        bookingId, transaction.getTransactionId(), e.getErrorCode(), e.getMessage());
                transactionTemplate.execute(status ->
                        doReconcile(transaction.getTransactionId(), TransactionStatus.FAILED, e.getMessage()));
                throw BookingException.paymentRejected(bookingId, e.getMessage());
            }
            // outcome unknown: keep the transaction open and let polling settle it
            reference = e.getExternalReference() != null ? e.getExternalReference() : transaction.getTransactionId();
            note = e.getErrorCode();
            meterRegistry.counter("payment.initiate.total", "result", "unknown").increment();
            log.warn("Payment initiation outcome unknown, will poll: bookingId={}, transactionId={}, code={}",
                    bookingId, transaction.getTransactionId(), e.getErrorCode());
        }

        String externalReference = reference;
        String failureNote = note;
        PaymentTransaction pending;
        try {
            pending = transactionTemplate.execute(status ->
                    markPending(transaction.getTransactionId(), externalReference, failureNote));
        } catch (OptimisticLockingFailureException e) {
            // a notification settled the transaction first; report what it decided
            log.info("Transaction resolved while being marked pending: bookingId={}, transactionId={}",
                    bookingId, transaction.getTransactionId());
            pending = transactionRepository.findById(transaction.getTransactionId())
                    .orElseThrow(() -> new PaymentTransactionNotFoundException(transaction.getTransactionId()));
        }

        if (pending.getStatus() == TransactionStatus.PENDING) {
            eventPublisher.publishEvent(new PaymentPendingEvent(this, pending.getTransactionId(), bookingId));
            if (failureNote == null) {
                meterRegistry.counter("payment.initiate.total", "result", "pending").increment();
            }
        }

        log.info("Payment initiated: bookingId={}, transactionId={}, status={}",
                bookingId, pending.getTransactionId(), pending.getStatus());
        return PaymentMapper.toEntry(pending);
    }

    /**
     * Applies a terminal status to a transaction and its booking atomically.
     *
     * @return false when the transaction was already terminal and nothing changed
     */
    @Transactional
    public boolean reconcile(String transactionId, TransactionStatus terminalStatus) {
        return doReconcile(transactionId, terminalStatus, null);
    }

    @Transactional
    public boolean reconcile(String transactionId, TransactionStatus terminalStatus, String reason) {
        return doReconcile(transactionId, terminalStatus, reason);
    }

    @Transactional(readOnly = true)
    public PaymentStatusEntry getPaymentStatus(String bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));

        Optional<PaymentTransaction> latest = transactionRepository.findFirstByBookingIdOrderByCreatedAtDesc(bookingId);
        if (latest.isEmpty()) {
            return PaymentStatusEntry.builder()
                    .bookingId(bookingId)
                    .bookingStatus(booking.getPaymentStatus().name())
                    .message(PaymentConstants.MESSAGE_NO_PAYMENT)
                    .build();
        }

        PaymentTransaction transaction = latest.get();
        return PaymentStatusEntry.builder()
                .bookingId(bookingId)
                .transactionId(transaction.getTransactionId())
                .status(transaction.getStatus().name())
                .bookingStatus(booking.getPaymentStatus().name())
                .message(statusMessage(transaction))
                .build();
    }

    // ============ Private Methods ============

    private PaymentTransaction claimTransaction(String bookingId, PaymentGateway gateway, String phoneNumber) {
        try {
            return transactionTemplate.execute(status -> doClaimTransaction(bookingId, gateway, phoneNumber));
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            if (transactionRepository.existsByActiveBookingId(bookingId)) {
                log.info("Concurrent payment initiation lost the race: bookingId={}", bookingId);
                throw BookingException.transactionAlreadyInProgress(bookingId);
            }
            log.info("Booking changed while claiming payment: bookingId={}", bookingId);
            throw BookingException.concurrentModification("Booking changed while starting payment, please retry", e);
        }
    }

    private PaymentTransaction doClaimTransaction(String bookingId, PaymentGateway gateway, String phoneNumber) {
        // version bump makes a concurrent seat change on this booking retry and see the claim
        Booking booking = bookingRepository.findForPaymentClaim(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));

        if (booking.getPaymentStatus() == BookingPaymentStatus.CANCELLED) {
            throw BookingException.bookingCancelled(bookingId);
        }
        if (booking.getPaymentStatus() == BookingPaymentStatus.PAYMENT_IN_PROGRESS
                || transactionRepository.existsByActiveBookingId(bookingId)) {
            throw BookingException.transactionAlreadyInProgress(bookingId);
        }

        int unpaidSeats = booking.unpaidSeats();
        if (unpaidSeats <= 0) {
            throw BookingException.nothingToCharge(bookingId);
        }

        Ride ride = rideRepository.findById(booking.getRideId())
                .orElseThrow(() -> new RideNotFoundException(booking.getRideId()));
        BigDecimal amount = ride.getPricePerSeat().multiply(BigDecimal.valueOf(unpaidSeats));
        if (amount.signum() <= 0) {
            throw BookingException.nothingToCharge(bookingId);
        }
        gateway.chargeableAmount(amount);

        if (booking.getPaymentStatus() == BookingPaymentStatus.FAILED) {
            // seats of a failed cycle went back to the ride
            inventoryService.reserve(booking.getRideId(), unpaidSeats);
            booking.setPaymentStatus(BookingPaymentStatus.AWAITING_PAYMENT);
            bookingRepository.save(booking);
            log.info("Seats re-reserved for failed booking: id={}, seats={}", bookingId, unpaidSeats);
        }

        PaymentTransaction transaction = PaymentTransaction.builder()
                .transactionId(IdGenerator.generateTransactionId())
                .bookingId(bookingId)
                .provider(gateway.provider())
                .amount(amount)
                .currency(currency)
                .phoneNumber(phoneNumber)
                .seatCount(booking.getSeats())
                .status(TransactionStatus.INITIATED)
                .activeBookingId(bookingId)
                .build();

        return transactionRepository.saveAndFlush(transaction);
    }

    private PaymentTransaction markPending(String transactionId, String externalReference, String note) {
        PaymentTransaction transaction = transactionRepository.findById(transactionId)
                .orElseThrow(() -> new PaymentTransactionNotFoundException(transactionId));

        if (transaction.getStatus().isTerminal()) {
            log.info("Transaction resolved before it went pending: id={}, status={}",
                    transactionId, transaction.getStatus());
            return transaction;
        }

        transaction.setStatus(TransactionStatus.PENDING);
        transaction.setExternalReference(externalReference);
        transaction.setFailureReason(note);
        transactionRepository.save(transaction);

        Booking booking = bookingRepository.findById(transaction.getBookingId())
                .orElseThrow(() -> new BookingNotFoundException(transaction.getBookingId()));
        if (booking.getPaymentStatus() == BookingPaymentStatus.AWAITING_PAYMENT) {
            booking.setPaymentStatus(BookingPaymentStatus.PAYMENT_IN_PROGRESS);
            bookingRepository.save(booking);
        }
        return transaction;
    }

    private boolean doReconcile(String transactionId, TransactionStatus terminalStatus, String reason) {
        if (terminalStatus == null || !terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }

        PaymentTransaction transaction = transactionRepository.findById(transactionId)
                .orElseThrow(() -> new PaymentTransactionNotFoundException(transactionId));

        int updated = transactionRepository.markTerminal(transactionId, terminalStatus, reason,
                LocalDateTime.now(), TransactionStatus.ACTIVE);
        if (updated == 0) {
            meterRegistry.counter("payment.reconcile.total", "outcome", "duplicate").increment();
            log.info("Transaction already resolved, ignoring: id={}, requested={}", transactionId, terminalStatus);
            return false;
        }

        Booking booking = bookingRepository.findById(transaction.getBookingId())
                .orElseThrow(() -> new BookingNotFoundException(transaction.getBookingId()));

        if (terminalStatus == TransactionStatus.SUCCEEDED) {
            applySuccess(booking, transaction);
        } else {
            bookingService.rollbackPaymentCycle(booking);
        }
        bookingRepository.save(booking);

        meterRegistry.counter("payment.reconcile.total", "outcome", terminalStatus.name().toLowerCase()).increment();
        log.info("Transaction reconciled: id={}, status={}, bookingId={}, bookingStatus={}, paidSeats={}",
                transactionId, terminalStatus, booking.getBookingId(), booking.getPaymentStatus(), booking.getPaidSeats());
        return true;
    }

    private void applySuccess(Booking booking, PaymentTransaction transaction) {
        int charged = transaction.getSeatCount();
        int newlyPaid = charged - booking.getPaidSeats();

        if (booking.getSeats() > charged) {
            // seats added after the charge was claimed stay held and unpaid
            log.error("Booking holds more seats than were charged: bookingId={}, seats={}, charged={}",
                    booking.getBookingId(), booking.getSeats(), charged);
            booking.setPaidSeats(charged);
            booking.setPaymentStatus(BookingPaymentStatus.AWAITING_PAYMENT);
        } else {
            if (booking.getSeats() < charged) {
                log.error("Booking holds fewer seats than were charged: bookingId={}, seats={}, charged={}",
                        booking.getBookingId(), booking.getSeats(), charged);
                newlyPaid = booking.getSeats() - booking.getPaidSeats();
            }
            booking.setPaidSeats(booking.getSeats());
            booking.setPaymentStatus(BookingPaymentStatus.COMPLETED);
        }
        inventoryService.commit(new ReservationToken(booking.getRideId(), newlyPaid));
        verificationService.issueCode(booking);
    }

    private static String statusMessage(PaymentTransaction transaction) {
        return switch (transaction.getStatus()) {
            case INITIATED -> PaymentConstants.MESSAGE_INITIATED;
            case PENDING -> PaymentConstants.MESSAGE_PENDING;
            case SUCCEEDED -> PaymentConstants.MESSAGE_SUCCEEDED;
            case FAILED -> transaction.getFailureReason() != null
                    ? PaymentConstants.MESSAGE_FAILED + ": " + transaction.getFailureReason()
                    : PaymentConstants.MESSAGE_FAILED;
            case EXPIRED -> PaymentConstants.MESSAGE_EXPIRED;
        };
    }
}
