package com.contactbook.backend.modules.auth.application;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Advisory cache of "access token key -> user id". A miss, or a failing backing store, always
 * falls through to the {@link CredentialStore}.
 */
public interface IdentityCache {

    Optional<UUID> get(String tokenKey);

    void put(String tokenKey, UUID userId, Duration ttl);

    void invalidate(String tokenKey);
}
