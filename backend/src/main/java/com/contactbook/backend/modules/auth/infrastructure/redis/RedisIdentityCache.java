package com.contactbook.backend.modules.auth.infrastructure.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import com.contactbook.backend.modules.auth.application.IdentityCache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis-backed identity cache.
 * <p>
 * Key space: {@code identity:{tokenKey}} with the user id as value and a TTL per entry.
 * Redis faults degrade to cache misses.
 */
@Component
public class RedisIdentityCache implements IdentityCache {

    private static final Logger log = LoggerFactory.getLogger(RedisIdentityCache.class);
    static final String KEY_PREFIX = "identity:";

    private final StringRedisTemplate redisTemplate;

    public RedisIdentityCache(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<UUID> get(String tokenKey) {
        String value;
        try {
            value = redisTemplate.opsForValue().get(key(tokenKey));
        } catch (DataAccessException ex) {
            log.warn("Identity cache read failed, falling back to credential store: {}", ex.getMessage());
            return Optional.empty();
        }
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException ex) {
            log.warn("Discarding malformed identity cache entry");
            invalidate(tokenKey);
            return Optional.empty();
        }
    }

    @Override
    public void put(String tokenKey, UUID userId, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(key(tokenKey), userId.toString(), ttl);
        } catch (DataAccessException ex) {
            log.warn("Identity cache write failed: {}", ex.getMessage());
        }
    }

    @Override
    public void invalidate(String tokenKey) {
        try {
            redisTemplate.delete(key(tokenKey));
        } catch (DataAccessException ex) {
            log.warn("Identity cache invalidation failed: {}", ex.getMessage());
        }
    }

    private static String key(String tokenKey) {
        return KEY_PREFIX + tokenKey;
    }
}
