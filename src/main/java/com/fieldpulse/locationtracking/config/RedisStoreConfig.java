package com.fieldpulse.locationtracking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldpulse.locationtracking.cache.ExpiringStore;
import com.fieldpulse.locationtracking.cache.RedisExpiringStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Shared expiring store for multi-instance deployments.
 *
 * Rate-limit windows, geocode results and cached reports all live in Redis so
 * every instance sees the same counters and the same invalidations.
 * The StringRedisTemplate comes from Spring Boot's Redis auto-configuration.
 */
@Configuration
@ConditionalOnProperty(name = "tracking.store.type", havingValue = "redis")
@Slf4j
public class RedisStoreConfig {

    @Bean
    public ExpiringStore redisExpiringStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock) {
        log.info("[CACHE] Expiring store: Redis");
        return new RedisExpiringStore(redisTemplate, objectMapper, clock);
    }
}
