package com.contactbook.backend.modules.ratelimit.domain;

/**
 * Group of routes sharing one rate-limit counter per client.
 * Credential-accepting buckets fail closed when the counter store is down.
 */
public enum RouteBucket {

    LOGIN("login", true),
    REGISTER("register", true),
    REFRESH("refresh", false),
    VERIFY_EMAIL("verify-email", false),
    RESEND_VERIFICATION("resend-verification", false),
    API("api", false);

    private static final String AUTH_PREFIX = "/api/auth/";

    private final String key;
    private final boolean failClosed;

    RouteBucket(String key, boolean failClosed) {
        this.key = key;
        this.failClosed = failClosed;
    }

    public String key() {
        return key;
    }

    public boolean failClosed() {
        return failClosed;
    }

    public static RouteBucket resolve(String method, String path) {
        if (path == null || !path.startsWith(AUTH_PREFIX)) {
            return API;
        }
        String route = path.substring(AUTH_PREFIX.length());
        boolean post = "POST".equalsIgnoreCase(method);
        if (post && route.equals("login")) {
            return LOGIN;
        }
        if (post && route.equals("signup")) {
            return REGISTER;
        }
        if (post && route.equals("refresh_token")) {
            return REFRESH;
        }
        if (post && route.equals("request_email")) {
            return RESEND_VERIFICATION;
        }
        if (route.startsWith("confirmed_email/")) {
            return VERIFY_EMAIL;
        }
        return API;
    }
}
