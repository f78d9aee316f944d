package com.contactbook.backend.modules.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.UUID;

import com.contactbook.backend.modules.auth.infrastructure.redis.RedisIdentityCache;
import com.contactbook.backend.modules.ratelimit.domain.RouteBucket;
import com.contactbook.backend.modules.ratelimit.infrastructure.RedisRateLimiter;
import com.contactbook.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class RedisStoresIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private RedisRateLimiter rateLimiter;

    @Autowired
    private RedisIdentityCache identityCache;

    @Test
    void luaCounterDeniesAfterLimitAndSetsExpiry() {
        String client = "ip:192.0.2.10";
        for (int i = 0; i < 3; i++) {
            assertThat(rateLimiter.allow(client, RouteBucket.RESEND_VERIFICATION)).isTrue();
        }
        assertThat(rateLimiter.allow(client, RouteBucket.RESEND_VERIFICATION)).isFalse();

        String key = redisTemplate.keys("ratelimit:resend-verification:" + client + ":*").iterator().next();
        assertThat(redisTemplate.opsForValue().get(key)).isEqualTo("4");
        assertThat(redisTemplate.getExpire(key)).isPositive().isLessThanOrEqualTo(Duration.ofMinutes(5).toSeconds());
    }

    @Test
    void identityCacheRoundTripsAndInvalidates() {
        UUID userId = UUID.randomUUID();

        identityCache.put("fp-1", userId, Duration.ofSeconds(30));

        assertThat(identityCache.get("fp-1")).contains(userId);
        assertThat(redisTemplate.getExpire("identity:fp-1")).isPositive().isLessThanOrEqualTo(30L);

        identityCache.invalidate("fp-1");
        assertThat(identityCache.get("fp-1")).isEmpty();
    }

    @Test
    void malformedCacheEntryIsTreatedAsMiss() {
        redisTemplate.opsForValue().set("identity:fp-2", "not-a-uuid");

        assertThat(identityCache.get("fp-2")).isEmpty();
        assertThat(redisTemplate.hasKey("identity:fp-2")).isFalse();
    }

    @Test
    void nonPositiveTtlIsNotCached() {
        identityCache.put("fp-3", UUID.randomUUID(), Duration.ZERO);

        assertThat(redisTemplate.hasKey("identity:fp-3")).isFalse();
    }
}
