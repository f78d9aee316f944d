package com.contactbook.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.contactbook.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByEmail(String email);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update AppUser u
               set u.refreshTokenFingerprint = :fingerprint,
                   u.updatedAt = :now
             where u.id = :id
            """)
    int updateFingerprint(@Param("id") UUID id,
                          @Param("fingerprint") String fingerprint,
                          @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update AppUser u
               set u.refreshTokenFingerprint = :next,
                   u.updatedAt = :now
             where u.id = :id
               and u.refreshTokenFingerprint = :expected
            """)
    int compareAndSetFingerprint(@Param("id") UUID id,
                                 @Param("expected") String expected,
                                 @Param("next") String next,
                                 @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update AppUser u
               set u.verified = true,
                   u.updatedAt = :now
             where u.id = :id
               and u.verified = false
            """)
    int markVerified(@Param("id") UUID id, @Param("now") OffsetDateTime now);
}
