package com.contactbook.backend.global.config;

import com.contactbook.backend.modules.ratelimit.application.RateLimitProperties;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis wiring shared by the rate limiter ({@code ratelimit:*}) and the identity cache
 * ({@code identity:*}). The connection itself comes from {@code spring.data.redis.*}.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(RateLimitProperties.class)
public class RedisConfig {

    // KEYS[1] counter key, ARGV[1] expiry in millis applied on the first hit of a window
    private static final String RATE_LIMIT_INCREMENT_LUA = """
            local current = redis.call('INCR', KEYS[1])
            if current == 1 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            return current
            """;

    @Bean
    public RedisScript<Long> rateLimitIncrementScript() {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setScriptText(RATE_LIMIT_INCREMENT_LUA);
        script.setResultType(Long.class);
        return script;
    }
}
