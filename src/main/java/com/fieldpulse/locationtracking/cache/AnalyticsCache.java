package com.fieldpulse.locationtracking.cache;

import com.fieldpulse.locationtracking.dto.TrackingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-user report cache on the {@link ExpiringStore}.
 *
 * Every cached report key embeds the user's current generation token. Replacing
 * the token (on each new point) orphans all of that user's reports at once,
 * whatever period or scope they were computed for; orphans age out on their TTL.
 *
 * Callers take the key with {@link #keyFor} BEFORE reading points, so a report
 * computed while a new point arrives is stored under the old generation.
 *
 * Cache trouble is never fatal here: failures are logged and treated as misses.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalyticsCache {

    static final String GENERATION_PREFIX = "tracking:gen:";
    static final String REPORT_PREFIX = "tracking:report:";

    private final ExpiringStore store;

    @Value("${tracking.analytics.cache-ttl-minutes:60}")
    private long ttlMinutes = 60;

    /**
     * @return the cache key for this report under the user's current generation,
     *         or null when the store is unavailable
     */
    public String keyFor(Long ownerId, String reportName) {
        try {
            String generationKey = GENERATION_PREFIX + ownerId;
            String generation = store.get(generationKey, String.class).orElse(null);
            if (generation == null) {
                generation = UUID.randomUUID().toString();
                store.put(generationKey, generation, ttl());
            }
            return REPORT_PREFIX + ownerId + ":" + generation + ":" + reportName;
        } catch (RuntimeException e) {
            log.warn("[CACHE] Generation lookup failed for user {}: {}", ownerId, e.getMessage());
            return null;
        }
    }

    public Optional<TrackingReport> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        try {
            return store.get(key, TrackingReport.class);
        } catch (RuntimeException e) {
            log.warn("[CACHE] Report lookup failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String key, TrackingReport report) {
        if (key == null) {
            return;
        }
        try {
            store.put(key, report, ttl());
        } catch (RuntimeException e) {
            log.warn("[CACHE] Report store failed for {}: {}", key, e.getMessage());
        }
    }

    /** Drops every cached report for the user. */
    public void invalidate(Long ownerId) {
        try {
            store.put(GENERATION_PREFIX + ownerId, UUID.randomUUID().toString(), ttl());
            log.debug("[CACHE] Reports invalidated for user {}", ownerId);
        } catch (RuntimeException e) {
            log.warn("[CACHE] Report invalidation failed for user {}: {}", ownerId, e.getMessage());
        }
    }

    private Duration ttl() {
        return Duration.ofMinutes(ttlMinutes);
    }
}
