package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.cache.ExpiringStore;
import com.fieldpulse.locationtracking.cache.WindowCount;
import com.fieldpulse.locationtracking.dto.RateLimitDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window cap on accepted points per user (default 2 per 60 s).
 *
 * The window lives in the shared {@link ExpiringStore}; the check and the
 * increment are one store operation. If the store is unreachable the point is
 * let through: losing the limiter must never stop a device's stream.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionRateLimiter {

    static final String KEY_PREFIX = "rate_limit:";

    private final ExpiringStore store;
    private final Clock clock;

    @Value("${tracking.rate-limit.max-points:2}")
    private int maxPoints = 2;

    @Value("${tracking.rate-limit.window-seconds:60}")
    private long windowSeconds = 60;

    public RateLimitDecision checkAndConsume(Long ownerId) {
        Duration window = Duration.ofSeconds(windowSeconds);
        try {
            WindowCount count = store.incrementWindow(KEY_PREFIX + ownerId, maxPoints, window);
            if (!count.isAllowed()) {
                log.debug("Rate limit exceeded for user {} — {} points per {}s, resets at {}",
                        ownerId, maxPoints, windowSeconds, count.getResetAt());
                return new RateLimitDecision(false, 0, count.getResetAt());
            }
            return new RateLimitDecision(true, Math.max(0, maxPoints - count.getCount()), count.getResetAt());
        } catch (RuntimeException e) {
            log.error("Rate limit check failed for user {}, allowing point: {}", ownerId, e.getMessage());
            return new RateLimitDecision(true, maxPoints - 1, Instant.now(clock).plus(window));
        }
    }
}
