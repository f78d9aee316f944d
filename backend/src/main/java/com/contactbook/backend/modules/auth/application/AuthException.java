package com.contactbook.backend.modules.auth.application;

import com.contactbook.backend.global.error.ProblemException;

public class AuthException extends ProblemException {

    private final AuthErrorCode errorCode;

    public AuthException(AuthErrorCode errorCode) {
        this(errorCode, null);
    }

    public AuthException(AuthErrorCode errorCode, Throwable cause) {
        super(errorCode.status(), errorCode.name(), errorCode.defaultDetail(), cause);
        this.errorCode = errorCode;
    }

    public AuthErrorCode getErrorCode() {
        return errorCode;
    }
}
