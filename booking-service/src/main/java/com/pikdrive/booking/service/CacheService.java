package com.pikdrive.booking.service;

import com.pikdrive.booking.constants.BookingConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort Redis cache of ride availability. The database stays
 * authoritative; every Redis failure is logged and ignored.
 * <p>
 * A read that loads the count just before a commit can write it back after the
 * eviction ran. Entries are short-lived so such a value expires quickly; the
 * count only feeds availability display, never a reservation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheService {

    private final RedisTemplate<String, Object> redisTemplate;

    public Optional<Integer> getAvailableSeats(String rideId) {
        String key = formatSeatsKey(rideId);
        try {
            Object value = redisTemplate.opsForValue().get(key);
            if (value != null) {
                return Optional.of(Integer.parseInt(value.toString()));
            }
        } catch (Exception e) {
            log.warn("Failed to get available seats for ride {}: {}", rideId, e.getMessage());
        }
        return Optional.empty();
    }

    public void setAvailableSeats(String rideId, int seats) {
        String key = formatSeatsKey(rideId);
        try {
            redisTemplate.opsForValue().set(key, seats,
                    BookingConstants.AVAILABLE_SEATS_CACHE_TTL_SECONDS, TimeUnit.SECONDS);
            log.debug("Cached available seats: rideId={}, seats={}", rideId, seats);
        } catch (Exception e) {
            log.warn("Failed to cache available seats for ride {}: {}", rideId, e.getMessage());
        }
    }

    public void evictAvailableSeats(String rideId) {
        String key = formatSeatsKey(rideId);
        try {
            redisTemplate.delete(key);
            log.debug("Evicted available seats: rideId={}", rideId);
        } catch (Exception e) {
            log.warn("Failed to evict available seats for ride {}: {}", rideId, e.getMessage());
        }
    }

    /**
     * Evicts once the surrounding transaction commits, so readers never
     * re-cache a count the database has not made visible yet.
     */
    public void evictAvailableSeatsAfterCommit(String rideId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            evictAvailableSeats(rideId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                evictAvailableSeats(rideId);
            }
        });
    }

    public String formatSeatsKey(String rideId) {
        return BookingConstants.REDIS_AVAILABLE_SEATS_PREFIX + rideId + BookingConstants.REDIS_AVAILABLE_SEATS_SUFFIX;
    }
}
