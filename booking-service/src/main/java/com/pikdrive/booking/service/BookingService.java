package com.pikdrive.booking.service;

import com.pikdrive.booking.constants.BookingConstants;
import com.pikdrive.booking.dto.BookingEntry;
import com.pikdrive.booking.dto.BookingRequest;
import com.pikdrive.booking.enums.BookingPaymentStatus;
import com.pikdrive.booking.exception.BookingException;
import com.pikdrive.booking.exception.BookingNotFoundException;
import com.pikdrive.booking.mapper.BookingMapper;
import com.pikdrive.booking.model.Booking;
import com.pikdrive.booking.repository.BookingRepository;
import com.pikdrive.booking.repository.PaymentTransactionRepository;
import com.pikdrive.booking.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * Creates and resizes a rider's booking on a ride.
 * <p>
 * Each request runs in its own transaction together with the matching capacity
 * change. A lost optimistic-lock race or a duplicate live booking insert rolls
 * the attempt back and the whole request is re-evaluated against fresh state, up
 * to {@code booking.max-attempts} times.
 */
@Service
@Slf4j
public class BookingService {

    private final BookingRepository bookingRepository;
    private final PaymentTransactionRepository transactionRepository;
    private final RideInventoryService inventoryService;
    private final TransactionTemplate transactionTemplate;

    private final int maxAttempts;

    public BookingService(
            BookingRepository bookingRepository,
            PaymentTransactionRepository transactionRepository,
            RideInventoryService inventoryService,
            PlatformTransactionManager transactionManager,
            @Value("${booking.max-attempts:" + BookingConstants.DEFAULT_MAX_ATTEMPTS + "}") int maxAttempts) {
        this.bookingRepository = bookingRepository;
        this.transactionRepository = transactionRepository;
        this.inventoryService = inventoryService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public BookingEntry createOrUpdateBooking(BookingRequest request) {
        validateBookingRequest(request);

        log.info("Booking request: ride={}, rider={}, seats={}",
                request.getRideId(), request.getRiderId(), request.getSeats());

        for (int attempt = 1; ; attempt++) {
            try {
                Booking booking = transactionTemplate.execute(status -> applyBookingRequest(request));
                return BookingMapper.toEntry(booking);
            } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
                if (attempt >= maxAttempts) {
                    log.warn("Giving up after {} conflicting attempts: ride={}, rider={}",
                            attempt, request.getRideId(), request.getRiderId());
                    throw BookingException.concurrentModification(
                            "Booking was modified concurrently, please retry", e);
                }
                log.info("Concurrent booking update, retrying: ride={}, rider={}, attempt={}",
                        request.getRideId(), request.getRiderId(), attempt);
            }
        }
    }

    /**
     * Cancels a booking and returns every seat it holds to the ride. Refused
     * while a payment is in flight.
     */
    @Transactional
    public BookingEntry cancelBooking(String bookingId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));

        if (booking.getPaymentStatus() == BookingPaymentStatus.CANCELLED) {
            log.info("Booking already cancelled: {}", bookingId);
            return BookingMapper.toEntry(booking);
        }
        if (booking.getPaymentStatus() == BookingPaymentStatus.PAYMENT_IN_PROGRESS
                || transactionRepository.existsByActiveBookingId(bookingId)) {
            throw BookingException.transactionAlreadyInProgress(bookingId);
        }

        int held = booking.heldSeats();
        inventoryService.release(booking.getRideId(), held);

        booking.setPaymentStatus(BookingPaymentStatus.CANCELLED);
        booking.setActiveKey(null);
        bookingRepository.save(booking);

        log.info("Booking cancelled: id={}, releasedSeats={}", bookingId, held);
        return BookingMapper.toEntry(booking);
    }

    /**
     * Rolls back an awaiting payment cycle whose reservation TTL elapsed without
     * a transaction being started.
     *
     * @return true when the booking was rolled back
     */
    @Transactional
    public boolean expireReservation(String bookingId) {
        Booking booking = bookingRepository.findById(bookingId).orElse(null);
        if (booking == null || booking.getPaymentStatus() != BookingPaymentStatus.AWAITING_PAYMENT) {
            return false;
        }
        if (transactionRepository.existsByActiveBookingId(bookingId)) {
            return false;
        }

        rollbackPaymentCycle(booking);
        bookingRepository.save(booking);
        log.info("Reservation expired: id={}, status={}", bookingId, booking.getPaymentStatus());
        return true;
    }

    /**
     * Releases the unpaid seats of the current cycle. A first purchase ends up
     * {@code FAILED}; a top-up falls back to the seats already paid.
     * Must run inside the caller's transaction.
     */
    public void rollbackPaymentCycle(Booking booking) {
        inventoryService.release(booking.getRideId(), booking.unpaidSeats());

        if (booking.getPaidSeats() > 0) {
            booking.setSeats(booking.getPaidSeats());
            booking.setPaymentStatus(BookingPaymentStatus.COMPLETED);
        } else {
            booking.setPaymentStatus(BookingPaymentStatus.FAILED);
        }
    }

    @Transactional(readOnly = true)
    public BookingEntry findById(String bookingId) {
        if (!StringUtils.hasText(bookingId)) {
            throw new BookingException("INVALID_BOOKING_ID", "Booking ID is required");
        }

        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));

        return BookingMapper.toEntry(booking);
    }

    @Transactional(readOnly = true)
    public List<BookingEntry> findByRiderId(String riderId) {
        if (!StringUtils.hasText(riderId)) {
            throw new BookingException("INVALID_RIDER_ID", "Rider ID is required");
        }

        return BookingMapper.toEntryList(bookingRepository.findByRiderIdOrderByCreatedAtDesc(riderId));
    }

    // ============ Private Methods ============

    private Booking applyBookingRequest(BookingRequest request) {
        String activeKey = Booking.activeKeyOf(request.getRideId(), request.getRiderId());
        Optional<Booking> existing = bookingRepository.findByActiveKey(activeKey);

        if (existing.isEmpty()) {
            return createBooking(request, activeKey);
        }

        Booking booking = existing.get();
        int requested = request.getSeats();
        if (requested < booking.getPaidSeats()) {
            throw BookingException.belowPaidSeats(booking.getPaidSeats());
        }

        return switch (booking.getPaymentStatus()) {
            case COMPLETED -> startTopUp(booking, requested);
            case AWAITING_PAYMENT -> adjustAwaitingBooking(booking, requested);
            case PAYMENT_IN_PROGRESS -> resubmitInProgress(booking, requested);
            case FAILED -> retryFailedBooking(booking, requested);
            case CANCELLED -> throw BookingException.bookingCancelled(booking.getBookingId());
        };
    }

    private Booking createBooking(BookingRequest request, String activeKey) {
        inventoryService.reserve(request.getRideId(), request.getSeats());

        Booking booking = Booking.builder()
                .bookingId(IdGenerator.generateBookingId())
                .rideId(request.getRideId())
                .riderId(request.getRiderId())
                .seats(request.getSeats())
                .paidSeats(0)
                .paymentStatus(BookingPaymentStatus.AWAITING_PAYMENT)
                .activeKey(activeKey)
                .build();

        // flush so a concurrent insert for the same rider surfaces inside the retry loop
        booking = bookingRepository.saveAndFlush(booking);
        log.info("Booking created: id={}, seats={}, status={}",
                booking.getBookingId(), booking.getSeats(), booking.getPaymentStatus());
        return booking;
    }

    private Booking startTopUp(Booking booking, int requested) {
        if (requested == booking.getSeats()) {
            log.info("Booking already complete with requested seats: id={}", booking.getBookingId());
            return booking;
        }

        int delta = requested - booking.getSeats();
        inventoryService.reserve(booking.getRideId(), delta);

        booking.setSeats(requested);
        booking.setPaymentStatus(BookingPaymentStatus.AWAITING_PAYMENT);
        log.info("Top-up started: id={}, paid={}, requested={}", booking.getBookingId(), booking.getPaidSeats(), requested);
        return bookingRepository.saveAndFlush(booking);
    }

    private Booking adjustAwaitingBooking(Booking booking, int requested) {
        int delta = requested - booking.getSeats();
        if (delta == 0) {
            return booking;
        }
        if (transactionRepository.existsByActiveBookingId(booking.getBookingId())) {
            throw BookingException.transactionAlreadyInProgress(booking.getBookingId());
        }

        if (delta > 0) {
            inventoryService.reserve(booking.getRideId(), delta);
        } else {
            inventoryService.release(booking.getRideId(), -delta);
        }

        booking.setSeats(requested);
        if (booking.getPaidSeats() > 0 && requested == booking.getPaidSeats()) {
            // top-up withdrawn
            booking.setPaymentStatus(BookingPaymentStatus.COMPLETED);
        }
        log.info("Booking resized: id={}, seats={}, status={}",
                booking.getBookingId(), requested, booking.getPaymentStatus());
        return bookingRepository.saveAndFlush(booking);
    }

    private Booking resubmitInProgress(Booking booking, int requested) {
        if (requested == booking.getSeats()) {
            return booking;
        }
        throw BookingException.transactionAlreadyInProgress(booking.getBookingId());
    }

    private Booking retryFailedBooking(Booking booking, int requested) {
        int delta = requested - booking.getPaidSeats();
        if (delta > 0) {
            inventoryService.reserve(booking.getRideId(), delta);
        }

        booking.setSeats(requested);
        booking.setPaymentStatus(delta > 0 ? BookingPaymentStatus.AWAITING_PAYMENT : BookingPaymentStatus.COMPLETED);
        log.info("Failed booking resubmitted: id={}, seats={}", booking.getBookingId(), requested);
        return bookingRepository.saveAndFlush(booking);
    }

    private void validateBookingRequest(BookingRequest request) {
        if (request == null) {
            throw new BookingException("INVALID_REQUEST", "Booking request is required");
        }
        if (!StringUtils.hasText(request.getRideId())) {
            throw new BookingException(BookingException.INVALID_RIDE, "Ride ID is required");
        }
        if (!StringUtils.hasText(request.getRiderId())) {
            throw new BookingException("INVALID_RIDER_ID", "Rider ID is required");
        }
        if (request.getSeats() == null || request.getSeats() < BookingConstants.MIN_SEATS_PER_BOOKING) {
            throw BookingException.invalidSeatCount("Requested seats must be positive");
        }
    }
}
