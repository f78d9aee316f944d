package com.contactbook.backend.modules.auth.infrastructure.persistence;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import com.contactbook.backend.modules.auth.application.AuthErrorCode;
import com.contactbook.backend.modules.auth.application.AuthException;
import com.contactbook.backend.modules.auth.application.CredentialStore;
import com.contactbook.backend.modules.auth.domain.AppUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class JpaCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCredentialStore.class);

    private final AppUserRepository appUserRepository;
    private final Clock clock;

    public JpaCredentialStore(AppUserRepository appUserRepository, Clock clock) {
        this.appUserRepository = appUserRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AppUser> findByEmail(String email) {
        return guard(() -> appUserRepository.findByEmail(email));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AppUser> findById(UUID id) {
        return guard(() -> appUserRepository.findById(id));
    }

    @Override
    public AppUser create(AppUser user) {
        try {
            return appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // unique(email) lost to a concurrent signup
            throw new AuthException(AuthErrorCode.EMAIL_TAKEN, ex);
        } catch (DataAccessException ex) {
            throw storeUnavailable(ex);
        }
    }

    @Override
    public void updateFingerprint(UUID id, String fingerprint) {
        guard(() -> appUserRepository.updateFingerprint(id, fingerprint, now()));
    }

    @Override
    public boolean compareAndSetFingerprint(UUID id, String expected, String next) {
        return guard(() -> appUserRepository.compareAndSetFingerprint(id, expected, next, now())) == 1;
    }

    @Override
    public boolean setVerified(UUID id) {
        return guard(() -> appUserRepository.markVerified(id, now())) == 1;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private <T> T guard(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException ex) {
            throw storeUnavailable(ex);
        }
    }

    private AuthException storeUnavailable(DataAccessException ex) {
        log.error("Credential store operation failed: {}", ex.getClass().getSimpleName());
        return new AuthException(AuthErrorCode.STORE_UNAVAILABLE, ex);
    }
}
