package com.contactbook.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
