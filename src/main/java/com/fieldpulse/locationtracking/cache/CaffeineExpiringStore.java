package com.fieldpulse.locationtracking.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * In-process {@link ExpiringStore} on a single Caffeine cache.
 *
 * Every entry carries its own deadline, so one cache holds geocodes (24 h),
 * reports (1 h) and rate-limit windows (60 s) side by side. The cache ticker
 * reads the injected clock, which keeps expiry testable.
 */
@Slf4j
public class CaffeineExpiringStore implements ExpiringStore {

    private final Clock clock;
    private final Cache<String, Entry> cache;

    public CaffeineExpiringStore(Clock clock, long maxEntries) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new EntryExpiry())
                .build();
        log.info("[STORE] Caffeine expiring store ready — max entries: {}", maxEntries);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            cache.invalidate(key);
            return Optional.empty();
        }
        if (!type.isInstance(entry.value)) {
            log.warn("[STORE] Entry '{}' holds {}, expected {}", key,
                    entry.value.getClass().getSimpleName(), type.getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.value));
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        cache.put(key, new Entry(value, clock.millis() + ttl.toMillis()));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public WindowCount incrementWindow(String key, int limit, Duration window) {
        long now = clock.millis();
        WindowCount[] outcome = new WindowCount[1];

        cache.asMap().compute(key, (k, existing) -> {
            boolean live = existing != null && !existing.isExpired(now) && existing.value instanceof Integer;
            if (!live) {
                long resetAt = now + window.toMillis();
                outcome[0] = new WindowCount(true, 1, Instant.ofEpochMilli(resetAt));
                return new Entry(1, resetAt);
            }
            int count = (Integer) existing.value;
            if (count >= limit) {
                outcome[0] = new WindowCount(false, count, Instant.ofEpochMilli(existing.expiresAtMillis));
                return existing;
            }
            outcome[0] = new WindowCount(true, count + 1, Instant.ofEpochMilli(existing.expiresAtMillis));
            return new Entry(count + 1, existing.expiresAtMillis);
        });

        return outcome[0];
    }

    private static final class Entry {
        private final Object value;
        private final long expiresAtMillis;

        private Entry(Object value, long expiresAtMillis) {
            this.value = value;
            this.expiresAtMillis = expiresAtMillis;
        }

        private boolean isExpired(long nowMillis) {
            return nowMillis >= expiresAtMillis;
        }
    }

    private final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return remaining(entry);
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return remaining(entry);
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remaining(Entry entry) {
            return TimeUnit.MILLISECONDS.toNanos(Math.max(0, entry.expiresAtMillis - clock.millis()));
        }
    }
}
