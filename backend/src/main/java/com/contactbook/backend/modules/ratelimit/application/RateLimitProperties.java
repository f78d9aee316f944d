package com.contactbook.backend.modules.ratelimit.application;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.contactbook.backend.modules.ratelimit.domain.RouteBucket;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Rate limit settings bound from {@code contactbook.rate-limit.*}.
 * Buckets without an explicit entry use the defaults below.
 */
@ConfigurationProperties(prefix = "contactbook.rate-limit")
public class RateLimitProperties {

    private static final Map<RouteBucket, Limit> DEFAULTS = defaults();

    /** Master switch; when off every request is allowed. */
    private boolean enabled = true;

    private Map<RouteBucket, Limit> buckets = new EnumMap<>(RouteBucket.class);

    /** Exact peer addresses allowed to supply X-Forwarded-For. */
    private List<String> trustedProxies = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<RouteBucket, Limit> getBuckets() {
        return buckets;
    }

    public void setBuckets(Map<RouteBucket, Limit> buckets) {
        this.buckets = buckets;
    }

    public List<String> getTrustedProxies() {
        return trustedProxies;
    }

    public void setTrustedProxies(List<String> trustedProxies) {
        this.trustedProxies = trustedProxies;
    }

    public Limit limitFor(RouteBucket bucket) {
        Limit configured = buckets.get(bucket);
        return configured != null ? configured : DEFAULTS.get(bucket);
    }

    private static Map<RouteBucket, Limit> defaults() {
        Map<RouteBucket, Limit> limits = new EnumMap<>(RouteBucket.class);
        limits.put(RouteBucket.LOGIN, new Limit(5, Duration.ofMinutes(1)));
        limits.put(RouteBucket.REGISTER, new Limit(3, Duration.ofMinutes(1)));
        limits.put(RouteBucket.REFRESH, new Limit(10, Duration.ofMinutes(1)));
        limits.put(RouteBucket.VERIFY_EMAIL, new Limit(10, Duration.ofMinutes(1)));
        limits.put(RouteBucket.RESEND_VERIFICATION, new Limit(3, Duration.ofMinutes(5)));
        limits.put(RouteBucket.API, new Limit(60, Duration.ofMinutes(1)));
        return limits;
    }

    public static class Limit {

        private int maxRequests;
        private Duration window;

        public Limit() {
        }

        public Limit(int maxRequests, Duration window) {
            this.maxRequests = maxRequests;
            this.window = window;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }
}
