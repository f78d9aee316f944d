package com.contactbook.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @NotBlank(message = "username is required")
        @Size(min = 5, max = 20, message = "username must be 5-20 characters") String username,
        @NotBlank(message = "email is required")
        @Email(message = "email must be a valid address") String email,
        @NotBlank(message = "password is required")
        @Size(min = 8, max = 25, message = "password must be 8-25 characters") String password
) {
}
