package com.contactbook.backend.modules.ratelimit.application;

import java.time.Duration;

import com.contactbook.backend.modules.ratelimit.domain.RouteBucket;

public interface RateLimiter {

    /**
     * Counts one request for {@code clientKey} in {@code bucket} and reports whether it fits the
     * configured ceiling of the current window.
     * <p>
     * When the counter store is unreachable, fail-closed buckets raise {@code STORE_UNAVAILABLE}
     * and all other buckets are allowed through.
     */
    boolean allow(String clientKey, RouteBucket bucket);

    /**
     * Time left until the current window of {@code bucket} rolls over.
     */
    Duration timeUntilReset(RouteBucket bucket);
}
