package com.fieldpulse.locationtracking.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link ExpiringStore} on Redis, for deployments running more than one instance.
 *
 * Values are stored as JSON strings with a native TTL. The window counter runs as a
 * Lua script so the limit check and the INCR happen in one server-side step.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisExpiringStore implements ExpiringStore {

    // KEYS[1] = window key, ARGV[1] = limit, ARGV[2] = window in ms
    // returns {count, pttl, allowed}
    private static final String WINDOW_LUA =
            "local current = tonumber(redis.call('GET', KEYS[1]) or '0') "
            + "if current >= tonumber(ARGV[1]) then "
            + "  return {current, redis.call('PTTL', KEYS[1]), 0} "
            + "end "
            + "current = redis.call('INCR', KEYS[1]) "
            + "if redis.call('PTTL', KEYS[1]) < 0 then "
            + "  redis.call('PEXPIRE', KEYS[1], ARGV[2]) "
            + "end "
            + "return {current, redis.call('PTTL', KEYS[1]), 1}";

    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> WINDOW_SCRIPT = new DefaultRedisScript<>(WINDOW_LUA, List.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("[STORE] Unreadable entry '{}' dropped — {}", key, e.getOriginalMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value),
                    ttl.toMillis(), TimeUnit.MILLISECONDS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize value for key " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    @Override
    @SuppressWarnings("unchecked")
    public WindowCount incrementWindow(String key, int limit, Duration window) {
        List<Long> reply = redisTemplate.execute(WINDOW_SCRIPT, List.of(key),
                String.valueOf(limit), String.valueOf(window.toMillis()));
        if (reply == null || reply.size() < 3) {
            throw new IllegalStateException("Unexpected rate window reply for key " + key);
        }
        long ttlMillis = Math.max(0, reply.get(1));
        Instant resetAt = Instant.ofEpochMilli(clock.millis() + ttlMillis);
        return new WindowCount(reply.get(2) == 1L, reply.get(0).intValue(), resetAt);
    }
}
