package com.contactbook.backend.modules.auth.presentation.dto;

public record SignupResponse(UserSummaryResponse user, String detail) {

    public static final String DEFAULT_DETAIL = "User successfully created. Check your email for confirmation.";
}
