package com.contactbook.backend.modules.ratelimit.presentation;

import java.util.Set;

import com.contactbook.backend.global.security.SecurityUtils;
import com.contactbook.backend.modules.ratelimit.application.RateLimitExceededException;
import com.contactbook.backend.modules.ratelimit.application.RateLimitProperties;
import com.contactbook.backend.modules.ratelimit.application.RateLimiter;
import com.contactbook.backend.modules.ratelimit.domain.RouteBucket;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies the per-bucket limits before the handler runs.
 * <p>
 * Anonymous clients are keyed by the connecting address. {@code X-Forwarded-For} is only read when
 * that address is a configured trusted proxy, and then the nearest hop not owned by a trusted proxy wins.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private final RateLimiter rateLimiter;
    private final Set<String> trustedProxies;

    public RateLimitInterceptor(RateLimiter rateLimiter, RateLimitProperties properties) {
        this.rateLimiter = rateLimiter;
        this.trustedProxies = Set.copyOf(properties.getTrustedProxies());
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        RouteBucket bucket = RouteBucket.resolve(request.getMethod(), path);
        String clientKey = resolveClientKey(request);
        if (!rateLimiter.allow(clientKey, bucket)) {
            long retryAfter = Math.max(1L, (rateLimiter.timeUntilReset(bucket).toMillis() + 999L) / 1000L);
            throw new RateLimitExceededException(retryAfter);
        }
        return true;
    }

    String resolveClientKey(HttpServletRequest request) {
        return SecurityUtils.findCurrentPrincipal()
                .map(principal -> "user:" + principal.userId())
                .orElseGet(() -> "ip:" + resolveClientIp(request));
    }

    private String resolveClientIp(HttpServletRequest request) {
        String peer = request.getRemoteAddr();
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (!trustedProxies.contains(peer) || !StringUtils.hasText(forwarded)) {
            return peer;
        }
        String[] hops = forwarded.split(",");
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (!hop.isEmpty() && !trustedProxies.contains(hop)) {
                return hop;
            }
        }
        return peer;
    }
}
