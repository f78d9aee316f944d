package com.contactbook.backend.modules.auth.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Value of the signed {@code type} claim. A token is only accepted by the operation matching its type.
 */
public enum TokenType {

    ACCESS("access"),
    REFRESH("refresh"),
    EMAIL_VERIFICATION("email_verification");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenType> fromClaim(String value) {
        return Arrays.stream(values())
                .filter(type -> type.claimValue.equals(value))
                .findFirst();
    }
}
