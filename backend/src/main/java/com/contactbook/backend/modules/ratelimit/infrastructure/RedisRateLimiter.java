package com.contactbook.backend.modules.ratelimit.infrastructure;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import com.contactbook.backend.modules.auth.application.AuthErrorCode;
import com.contactbook.backend.modules.auth.application.AuthException;
import com.contactbook.backend.modules.ratelimit.application.RateLimitProperties;
import com.contactbook.backend.modules.ratelimit.application.RateLimitProperties.Limit;
import com.contactbook.backend.modules.ratelimit.application.RateLimiter;
import com.contactbook.backend.modules.ratelimit.domain.RouteBucket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

/**
 * Fixed-window limiter on Redis.
 * <p>
 * Key space: {@code ratelimit:{bucket}:{clientKey}:{windowIndex}}. One Lua call increments the
 * counter and sets its expiry on the first hit, so concurrent requests never lose an update.
 */
@Component
public class RedisRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimiter.class);
    static final String KEY_PREFIX = "ratelimit:";

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> incrementScript;
    private final RateLimitProperties properties;
    private final Clock clock;

    public RedisRateLimiter(
            StringRedisTemplate redisTemplate,
            RedisScript<Long> rateLimitIncrementScript,
            RateLimitProperties properties,
            Clock clock
    ) {
        this.redisTemplate = redisTemplate;
        this.incrementScript = rateLimitIncrementScript;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public boolean allow(String clientKey, RouteBucket bucket) {
        if (!properties.isEnabled()) {
            return true;
        }
        Limit limit = properties.limitFor(bucket);
        long windowMillis = limit.getWindow().toMillis();
        long now = clock.millis();
        long windowIndex = now / windowMillis;
        long ttlMillis = windowMillis - (now % windowMillis);

        String key = KEY_PREFIX + bucket.key() + ":" + clientKey + ":" + windowIndex;
        Long count;
        try {
            count = redisTemplate.execute(incrementScript, List.of(key), String.valueOf(ttlMillis));
        } catch (DataAccessException ex) {
            return onStoreFailure(bucket, ex.getMessage());
        }
        if (count == null) {
            return onStoreFailure(bucket, "no result from increment script");
        }
        return count <= limit.getMaxRequests();
    }

    @Override
    public Duration timeUntilReset(RouteBucket bucket) {
        long windowMillis = properties.limitFor(bucket).getWindow().toMillis();
        return Duration.ofMillis(windowMillis - (clock.millis() % windowMillis));
    }

    private boolean onStoreFailure(RouteBucket bucket, String reason) {
        if (bucket.failClosed()) {
            log.warn("[SECURITY] Rate limit store unavailable, rejecting {} request: {}", bucket.key(), reason);
            throw new AuthException(AuthErrorCode.STORE_UNAVAILABLE);
        }
        log.warn("Rate limit store unavailable, allowing {} request: {}", bucket.key(), reason);
        return true;
    }
}
