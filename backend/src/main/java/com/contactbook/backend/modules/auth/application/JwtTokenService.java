package com.contactbook.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import com.contactbook.backend.modules.auth.domain.TokenType;
import com.contactbook.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and validates HS256 JWTs. The {@code type} claim is part of the signed payload, so a
 * refresh token can never be replayed where an access token is expected (and vice versa).
 */
@Service
public class JwtTokenService {

    static final String CLAIM_TYPE = "type";

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Duration emailVerificationTokenTtl;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            @Value("${jwt.email-verification-expiration:86400000}") long emailVerificationTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtl = Duration.ofMillis(accessTokenTtlMillis);
        this.refreshTokenTtl = Duration.ofMillis(refreshTokenTtlMillis);
        this.emailVerificationTokenTtl = Duration.ofMillis(emailVerificationTtlMillis);
        this.clock = clock;
    }

    public String issueAccess(String subject) {
        return issue(subject, TokenType.ACCESS, accessTokenTtl);
    }

    public String issueRefresh(String subject) {
        return issue(subject, TokenType.REFRESH, refreshTokenTtl);
    }

    public String issueEmailVerification(String subject) {
        return issue(subject, TokenType.EMAIL_VERIFICATION, emailVerificationTokenTtl);
    }

    /**
     * Verifies signature, expiry and type of {@code token}.
     *
     * @throws AuthException {@code TOKEN_INVALID}, {@code TOKEN_EXPIRED} or {@code TOKEN_TYPE_MISMATCH}
     */
    public DecodedToken decode(String token, TokenType expectedType) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthException(AuthErrorCode.TOKEN_EXPIRED, e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorCode.TOKEN_INVALID, e);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank() || claims.getExpiration() == null) {
            throw new AuthException(AuthErrorCode.TOKEN_INVALID);
        }
        TokenType type = TokenType.fromClaim(claims.get(CLAIM_TYPE, String.class))
                .orElseThrow(() -> new AuthException(AuthErrorCode.TOKEN_INVALID));
        if (type != expectedType) {
            throw new AuthException(AuthErrorCode.TOKEN_TYPE_MISMATCH);
        }

        Instant expiresAt = claims.getExpiration().toInstant();
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : expiresAt;
        return new DecodedToken(subject, type, issuedAt, expiresAt);
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }

    private String issue(String subject, TokenType type, Duration ttl) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("token subject must not be blank");
        }
        Instant now = clock.instant();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(subject)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .claim(CLAIM_TYPE, type.claimValue())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    public record DecodedToken(String subject, TokenType type, Instant issuedAt, Instant expiresAt) {

        public Duration remainingLifetime(Clock clock) {
            Duration remaining = Duration.between(clock.instant(), expiresAt);
            return remaining.isNegative() ? Duration.ZERO : remaining;
        }
    }
}
