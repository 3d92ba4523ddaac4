package com.pikdrive.booking.service;

import com.pikdrive.booking.dto.ReservationToken;
import com.pikdrive.booking.exception.BookingException;
import com.pikdrive.booking.exception.InsufficientCapacityException;
import com.pikdrive.booking.exception.RideNotFoundException;
import com.pikdrive.booking.repository.RideRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Seat capacity of rides.
 * <p>
 * Capacity changes are single conditional UPDATE statements on the ride row, so
 * concurrent reservations on one ride can never push committed seats past the
 * total. Callers running inside a booking transaction join it, which keeps the
 * capacity change and the booking change atomic.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RideInventoryService {

    private final RideRepository rideRepository;
    private final CacheService cacheService;
    private final MeterRegistry meterRegistry;

    @Transactional
    public ReservationToken reserve(String rideId, int seats) {
        if (seats <= 0) {
            throw BookingException.invalidSeatCount("Seats to reserve must be positive: " + seats);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            int updated = rideRepository.reserveSeats(rideId, seats);
            if (updated == 0) {
                int available = rideRepository.findAvailableSeats(rideId)
                        .orElseThrow(() -> new RideNotFoundException(rideId));
                meterRegistry.counter("inventory.reserve.total", "result", "no_seats").increment();
                log.warn("Insufficient seats: rideId={}, requested={}, available={}", rideId, seats, available);
                throw new InsufficientCapacityException(rideId, seats, Math.max(0, available));
            }

            cacheService.evictAvailableSeatsAfterCommit(rideId);
            meterRegistry.counter("inventory.reserve.total", "result", "success").increment();
            log.info("Seats reserved: rideId={}, seats={}", rideId, seats);
            return new ReservationToken(rideId, seats);
        } finally {
            sample.stop(Timer.builder("inventory.reserve.duration").register(meterRegistry));
        }
    }

    /**
     * Returns seats to the ride. Committed seats never drop below zero.
     */
    @Transactional
    public void release(String rideId, int seats) {
        if (seats <= 0) {
            return;
        }

        int updated = rideRepository.releaseSeats(rideId, seats);
        if (updated == 0) {
            meterRegistry.counter("inventory.release.total", "result", "not_found").increment();
            log.warn("Release on unknown ride ignored: rideId={}, seats={}", rideId, seats);
            return;
        }

        cacheService.evictAvailableSeatsAfterCommit(rideId);
        meterRegistry.counter("inventory.release.total", "result", "success").increment();
        log.info("Seats released: rideId={}, seats={}", rideId, seats);
    }

    /**
     * Makes a reservation permanent. Seats were already counted at reserve
     * time, so nothing changes on the ride row.
     */
    public void commit(ReservationToken token) {
        if (token.getSeats() <= 0) {
            return;
        }
        meterRegistry.counter("inventory.commit.total").increment();
        log.info("Seats committed: rideId={}, seats={}", token.getRideId(), token.getSeats());
    }

    @Transactional(readOnly = true)
    public int availableSeats(String rideId) {
        return cacheService.getAvailableSeats(rideId).orElseGet(() -> {
            int available = Math.max(0, rideRepository.findAvailableSeats(rideId)
                    .orElseThrow(() -> new RideNotFoundException(rideId)));
            cacheService.setAvailableSeats(rideId, available);
            return available;
        });
    }
}
