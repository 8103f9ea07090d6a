package com.fieldpulse.locationtracking.config;

import com.fieldpulse.locationtracking.cache.CaffeineExpiringStore;
import com.fieldpulse.locationtracking.cache.ExpiringStore;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine caching for this instance.
 *
 *   ownerScopes   : user directory lookups done on every ingest and report.
 *                   TTL: 10 minutes. Max entries: 10 000.
 *
 * The {@link ExpiringStore} behind rate limits, geocodes and reports is also
 * Caffeine unless {@code tracking.store.type=redis} (see {@link RedisStoreConfig}).
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CACHE_OWNER_SCOPES = "ownerScopes";

    @Bean
    public CacheManager cacheManager() {
        log.info("[CACHE] Initialising Caffeine CacheManager, caches: '{}'", CACHE_OWNER_SCOPES);

        SimpleCacheManager manager = new SimpleCacheManager();
        manager.setCaches(List.of(
                buildCache(CACHE_OWNER_SCOPES, 10, 10_000)
        ));
        return manager;
    }

    @Bean
    @ConditionalOnProperty(name = "tracking.store.type", havingValue = "caffeine", matchIfMissing = true)
    public ExpiringStore caffeineExpiringStore(Clock clock,
                                               @Value("${tracking.store.max-entries:100000}") long maxEntries) {
        log.info("[CACHE] Expiring store: in-process Caffeine, max {} entries", maxEntries);
        return new CaffeineExpiringStore(clock, maxEntries);
    }

    private CaffeineCache buildCache(String name, int ttlMinutes, int maxSize) {
        return new CaffeineCache(name,
                Caffeine.newBuilder()
                        .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                        .maximumSize(maxSize)
                        .recordStats()
                        .build());
    }
}
