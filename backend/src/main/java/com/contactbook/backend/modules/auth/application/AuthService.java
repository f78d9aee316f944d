package com.contactbook.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.contactbook.backend.modules.auth.application.JwtTokenService.DecodedToken;
import com.contactbook.backend.modules.auth.domain.AppUser;
import com.contactbook.backend.modules.auth.domain.TokenType;
import com.contactbook.backend.modules.auth.presentation.dto.LoginRequest;
import com.contactbook.backend.modules.auth.presentation.dto.MessageResponse;
import com.contactbook.backend.modules.auth.presentation.dto.RefreshRequest;
import com.contactbook.backend.modules.auth.presentation.dto.ResendVerificationRequest;
import com.contactbook.backend.modules.auth.presentation.dto.SignupRequest;
import com.contactbook.backend.modules.auth.presentation.dto.SignupResponse;
import com.contactbook.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.contactbook.backend.modules.auth.presentation.dto.UserSummaryResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Registration, login, refresh-token rotation, logout, email verification and identity
 * resolution.
 * <p>
 * Not transactional: each store call is its own atomic statement, so a cleared fingerprint
 * stays cleared when the call then fails.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String EMAIL_CONFIRMED = "Email confirmed";
    static final String EMAIL_ALREADY_CONFIRMED = "Your email is already confirmed";
    static final String CHECK_YOUR_EMAIL = "Check your email for confirmation.";
    private static final String VERIFICATION_PATH = "/api/auth/confirmed_email/";

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final JwtTokenService jwtTokenService;
    private final IdentityCache identityCache;
    private final VerificationMailer verificationMailer;
    private final Clock clock;
    private final Duration identityCacheTtl;
    private final String publicBaseUrl;

    public AuthService(
            CredentialStore credentialStore,
            PasswordHasher passwordHasher,
            JwtTokenService jwtTokenService,
            IdentityCache identityCache,
            VerificationMailer verificationMailer,
            Clock clock,
            @Value("${contactbook.identity-cache.ttl:PT60S}") Duration identityCacheTtl,
            @Value("${contactbook.public-base-url:http://localhost:8080}") String publicBaseUrl
    ) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.jwtTokenService = jwtTokenService;
        this.identityCache = identityCache;
        this.verificationMailer = verificationMailer;
        this.clock = clock;
        this.identityCacheTtl = identityCacheTtl;
        this.publicBaseUrl = stripTrailingSlash(publicBaseUrl);
    }

    public SignupResponse register(SignupRequest request) {
        String email = normalizeEmail(request.email());
        if (credentialStore.findByEmail(email).isPresent()) {
            throw new AuthException(AuthErrorCode.EMAIL_TAKEN);
        }

        AppUser user = new AppUser();
        user.setUsername(request.username().trim());
        user.setEmail(email);
        user.setPasswordHash(passwordHasher.hash(request.password()));
        user.setVerified(false);

        AppUser created = credentialStore.create(user);
        log.info("Registered user id={}", created.getId());

        dispatchVerificationMail(created);
        return new SignupResponse(UserSummaryResponse.from(created), SignupResponse.DEFAULT_DETAIL);
    }

    public TokenPairResponse login(LoginRequest request) {
        // unknown email and wrong password must be indistinguishable to the caller
        AppUser user = credentialStore.findByEmail(normalizeEmail(request.email()))
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_CREDENTIALS));

        if (!passwordHasher.verify(request.password(), user.getPasswordHash())) {
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }

        if (!user.isVerified()) {
            throw new AuthException(AuthErrorCode.EMAIL_NOT_VERIFIED);
        }

        TokenPairResponse tokens = issueTokenPair(user.getId());
        // single active refresh session: any earlier refresh token stops matching
        credentialStore.updateFingerprint(user.getId(), TokenFingerprints.of(tokens.refreshToken()));
        return tokens;
    }

    public TokenPairResponse refresh(RefreshRequest request) {
        String presentedToken = request.refreshToken();
        DecodedToken decoded = jwtTokenService.decode(presentedToken, TokenType.REFRESH);
        UUID userId = parseUserId(decoded.subject(), AuthErrorCode.TOKEN_INVALID);

        AppUser user = credentialStore.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.TOKEN_INVALID));

        String presentedFingerprint = TokenFingerprints.of(presentedToken);
        if (!Objects.equals(presentedFingerprint, user.getRefreshTokenFingerprint())) {
            throw terminateOnReuse(userId);
        }

        TokenPairResponse tokens = issueTokenPair(userId);
        String nextFingerprint = TokenFingerprints.of(tokens.refreshToken());
        if (!credentialStore.compareAndSetFingerprint(userId, presentedFingerprint, nextFingerprint)) {
            // a concurrent refresh with the same token won the swap
            throw terminateOnReuse(userId);
        }
        return tokens;
    }

    public void logout(UUID userId, String accessToken) {
        credentialStore.updateFingerprint(userId, null);
        if (accessToken != null) {
            identityCache.invalidate(TokenFingerprints.of(accessToken));
        }
        log.info("User id={} logged out", userId);
    }

    public MessageResponse verifyEmail(String token) {
        DecodedToken decoded = jwtTokenService.decode(token, TokenType.EMAIL_VERIFICATION);
        AppUser user = credentialStore.findByEmail(normalizeEmail(decoded.subject()))
                .orElseThrow(() -> new AuthException(AuthErrorCode.TOKEN_INVALID));

        if (user.isVerified()) {
            return new MessageResponse(EMAIL_ALREADY_CONFIRMED);
        }
        if (!credentialStore.setVerified(user.getId())) {
            return new MessageResponse(EMAIL_ALREADY_CONFIRMED);
        }
        log.info("User id={} verified email", user.getId());
        return new MessageResponse(EMAIL_CONFIRMED);
    }

    public MessageResponse resendVerification(ResendVerificationRequest request) {
        Optional<AppUser> user = credentialStore.findByEmail(normalizeEmail(request.email()));
        if (user.isPresent() && user.get().isVerified()) {
            return new MessageResponse(EMAIL_ALREADY_CONFIRMED);
        }
        user.ifPresent(this::dispatchVerificationMail);
        return new MessageResponse(CHECK_YOUR_EMAIL);
    }

    /**
     * Resolves the user behind an access token, consulting the identity cache first.
     *
     * @throws AuthException {@code UNAUTHORIZED} on any token failure or when the user no longer exists
     */
    public AuthenticatedUser resolveIdentity(String accessToken) {
        DecodedToken decoded;
        try {
            decoded = jwtTokenService.decode(accessToken, TokenType.ACCESS);
        } catch (AuthException ex) {
            throw new AuthException(AuthErrorCode.UNAUTHORIZED, ex);
        }

        String cacheKey = TokenFingerprints.of(accessToken);
        Optional<UUID> cached = identityCache.get(cacheKey);
        if (cached.isPresent()) {
            return new AuthenticatedUser(cached.get());
        }

        UUID userId = parseUserId(decoded.subject(), AuthErrorCode.UNAUTHORIZED);
        AppUser user = credentialStore.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.UNAUTHORIZED));

        Duration ttl = min(identityCacheTtl, decoded.remainingLifetime(clock));
        identityCache.put(cacheKey, user.getId(), ttl);
        return new AuthenticatedUser(user.getId());
    }

    public UserSummaryResponse loadProfile(UUID userId) {
        return credentialStore.findById(userId)
                .map(UserSummaryResponse::from)
                .orElseThrow(() -> new AuthException(AuthErrorCode.UNAUTHORIZED));
    }

    private TokenPairResponse issueTokenPair(UUID userId) {
        String subject = userId.toString();
        return new TokenPairResponse(
                jwtTokenService.issueAccess(subject),
                jwtTokenService.issueRefresh(subject),
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                jwtTokenService.getAccessTokenTtl().toSeconds(),
                jwtTokenService.getRefreshTokenTtl().toSeconds()
        );
    }

    private AuthException terminateOnReuse(UUID userId) {
        credentialStore.updateFingerprint(userId, null);
        log.warn("[SECURITY] Refresh token reuse detected for user id={}, session terminated", userId);
        return new AuthException(AuthErrorCode.REFRESH_REUSE_DETECTED);
    }

    private void dispatchVerificationMail(AppUser user) {
        String token = jwtTokenService.issueEmailVerification(user.getEmail());
        String link = publicBaseUrl + VERIFICATION_PATH + token;
        try {
            verificationMailer.sendVerificationEmail(user.getEmail(), user.getUsername(), link);
        } catch (RuntimeException ex) {
            log.warn("Could not hand off verification mail for user id={}: {}", user.getId(), ex.getMessage());
        }
    }

    private static UUID parseUserId(String subject, AuthErrorCode failure) {
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException ex) {
            throw new AuthException(failure, ex);
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
