package com.contactbook.backend.modules.auth.application;

import java.util.UUID;

/**
 * Identity resolved from a valid access token; the only input protected routes need from auth.
 */
public record AuthenticatedUser(UUID userId) {
}
