package com.contactbook.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.contactbook.backend.modules.auth.domain.AppUser;

public record UserSummaryResponse(
        UUID id,
        String username,
        String email,
        String avatar,
        boolean verified,
        OffsetDateTime createdAt
) {

    public static UserSummaryResponse from(AppUser user) {
        return new UserSummaryResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getAvatarUrl(),
                user.isVerified(),
                user.getCreatedAt()
        );
    }
}
