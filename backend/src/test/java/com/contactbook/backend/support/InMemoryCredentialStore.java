package com.contactbook.backend.support;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.contactbook.backend.modules.auth.application.AuthErrorCode;
import com.contactbook.backend.modules.auth.application.AuthException;
import com.contactbook.backend.modules.auth.application.CredentialStore;
import com.contactbook.backend.modules.auth.domain.AppUser;

/**
 * Map-backed {@link CredentialStore}. Reads hand out copies, as rows loaded from a database would,
 * and each mutation is atomic per user.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<UUID, AppUser> users = new ConcurrentHashMap<>();

    @Override
    public Optional<AppUser> findByEmail(String email) {
        return users.values().stream()
                .filter(user -> user.getEmail().equals(email))
                .findFirst()
                .map(InMemoryCredentialStore::copy);
    }

    @Override
    public Optional<AppUser> findById(UUID id) {
        return Optional.ofNullable(users.get(id)).map(InMemoryCredentialStore::copy);
    }

    @Override
    public synchronized AppUser create(AppUser user) {
        boolean taken = users.values().stream().anyMatch(existing -> existing.getEmail().equals(user.getEmail()));
        if (taken) {
            throw new AuthException(AuthErrorCode.EMAIL_TAKEN);
        }
        AppUser stored = copy(user);
        stored.setId(UUID.randomUUID());
        users.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public void updateFingerprint(UUID id, String fingerprint) {
        users.computeIfPresent(id, (key, user) -> {
            user.setRefreshTokenFingerprint(fingerprint);
            return user;
        });
    }

    @Override
    public boolean compareAndSetFingerprint(UUID id, String expected, String next) {
        boolean[] swapped = {false};
        users.computeIfPresent(id, (key, user) -> {
            if (Objects.equals(user.getRefreshTokenFingerprint(), expected)) {
                user.setRefreshTokenFingerprint(next);
                swapped[0] = true;
            }
            return user;
        });
        return swapped[0];
    }

    @Override
    public boolean setVerified(UUID id) {
        boolean[] flipped = {false};
        users.computeIfPresent(id, (key, user) -> {
            if (!user.isVerified()) {
                user.setVerified(true);
                flipped[0] = true;
            }
            return user;
        });
        return flipped[0];
    }

    public AppUser require(String email) {
        return findByEmail(email).orElseThrow();
    }

    private static AppUser copy(AppUser source) {
        AppUser copy = new AppUser();
        copy.setId(source.getId());
        copy.setUsername(source.getUsername());
        copy.setEmail(source.getEmail());
        copy.setPasswordHash(source.getPasswordHash());
        copy.setAvatarUrl(source.getAvatarUrl());
        copy.setVerified(source.isVerified());
        copy.setRefreshTokenFingerprint(source.getRefreshTokenFingerprint());
        return copy;
    }
}
