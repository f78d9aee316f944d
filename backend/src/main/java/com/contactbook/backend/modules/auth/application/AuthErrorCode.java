package com.contactbook.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

public enum AuthErrorCode {

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password"),
    EMAIL_TAKEN(HttpStatus.CONFLICT, "Account already exists"),
    EMAIL_NOT_VERIFIED(HttpStatus.FORBIDDEN, "Email not confirmed"),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "Token is invalid"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "Token has expired"),
    TOKEN_TYPE_MISMATCH(HttpStatus.UNAUTHORIZED, "Token type is not accepted here"),
    REFRESH_REUSE_DETECTED(HttpStatus.UNAUTHORIZED, "Invalid refresh token"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Authentication required"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests"),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Backing store unavailable");

    private final HttpStatus status;
    private final String defaultDetail;

    AuthErrorCode(HttpStatus status, String defaultDetail) {
        this.status = status;
        this.defaultDetail = defaultDetail;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultDetail() {
        return defaultDetail;
    }
}
