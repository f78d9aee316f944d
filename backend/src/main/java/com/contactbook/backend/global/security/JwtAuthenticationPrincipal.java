package com.contactbook.backend.global.security;

import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, String accessToken) {

    @Override
    public String toString() {
        return "JwtAuthenticationPrincipal[userId=" + userId + "]";
    }
}
