package com.fieldpulse.locationtracking.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store whose entries expire on their own.
 *
 * Backs the geocode cache, the analytics cache and the ingestion rate-limit
 * windows. Implementations must make {@link #incrementWindow} a single atomic
 * read-modify-write so concurrent requests for one key cannot both pass the limit.
 */
public interface ExpiringStore {

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object value, Duration ttl);

    void delete(String key);

    /**
     * Counts one request against a fixed window.
     *
     * If no live window exists for the key a new one is opened with count 1.
     * If the live window is already at {@code limit} nothing changes and the
     * returned count is not allowed. Otherwise the count goes up by one.
     */
    WindowCount incrementWindow(String key, int limit, Duration window);
}
