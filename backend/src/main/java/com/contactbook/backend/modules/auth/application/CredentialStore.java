package com.contactbook.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.contactbook.backend.modules.auth.domain.AppUser;

/**
 * Persistence boundary for user credentials and session fingerprints.
 * <p>
 * Every mutation is a single conditional statement so that concurrent requests rely on the
 * store's atomicity instead of in-process locks. Implementations translate infrastructure
 * faults into {@link AuthErrorCode#STORE_UNAVAILABLE}.
 */
public interface CredentialStore {

    /**
     * @param email already normalised (trimmed, lower case)
     */
    Optional<AppUser> findByEmail(String email);

    Optional<AppUser> findById(UUID id);

    /**
     * Persists a new user.
     *
     * @throws AuthException with {@link AuthErrorCode#EMAIL_TAKEN} when the email is already registered
     */
    AppUser create(AppUser user);

    /**
     * Unconditionally replaces the stored fingerprint; {@code null} clears the session.
     */
    void updateFingerprint(UUID id, String fingerprint);

    /**
     * Replaces the stored fingerprint only if it still equals {@code expected}.
     *
     * @return {@code true} if this call performed the swap
     */
    boolean compareAndSetFingerprint(UUID id, String expected, String next);

    /**
     * Marks the user verified.
     *
     * @return {@code true} if the flag flipped, {@code false} if it was already set or the user is gone
     */
    boolean setVerified(UUID id);
}
