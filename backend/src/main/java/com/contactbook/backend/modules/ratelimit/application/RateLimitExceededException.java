package com.contactbook.backend.modules.ratelimit.application;

import com.contactbook.backend.global.error.RetryableProblemException;
import com.contactbook.backend.modules.auth.application.AuthErrorCode;

public class RateLimitExceededException extends RetryableProblemException {

    public RateLimitExceededException(long retryAfterSeconds) {
        super(AuthErrorCode.RATE_LIMITED.status(), AuthErrorCode.RATE_LIMITED.name(),
                AuthErrorCode.RATE_LIMITED.defaultDetail(), retryAfterSeconds);
    }
}
