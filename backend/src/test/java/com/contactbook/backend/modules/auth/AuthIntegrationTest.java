package com.contactbook.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.contactbook.backend.modules.auth.application.AuthErrorCode;
import com.contactbook.backend.modules.auth.application.AuthException;
import com.contactbook.backend.modules.auth.application.AuthService;
import com.contactbook.backend.modules.auth.application.JwtTokenService;
import com.contactbook.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.contactbook.backend.modules.auth.presentation.dto.RefreshRequest;
import com.contactbook.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.contactbook.backend.support.AbstractIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class AuthIntegrationTest extends AbstractIntegrationTest {

    private static final String EMAIL = "grace@example.com";
    private static final String PASSWORD = "compiler-1952";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtTokenService jwtTokenService;

    @Autowired
    private AppUserRepository appUserRepository;

    @Autowired
    private AuthService authService;

    @Test
    void signupReturnsSummaryWithoutPasswordHash() throws Exception {
        mockMvc.perform(postJson("/api/auth/signup", signupBody(EMAIL)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user.email").value(EMAIL))
                .andExpect(jsonPath("$.user.verified").value(false))
                .andExpect(jsonPath("$.user.createdAt").exists())
                .andExpect(jsonPath("$.user.passwordHash").doesNotExist())
                .andExpect(jsonPath("$.detail").value("User successfully created. Check your email for confirmation."));

        assertThat(appUserRepository.findByEmail(EMAIL)).isPresent();
    }

    @Test
    void duplicateSignupIsConflict() throws Exception {
        signup(EMAIL);

        mockMvc.perform(postJson("/api/auth/signup", signupBody("GRACE@example.com")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_TAKEN"));
    }

    @Test
    void invalidSignupIsRejectedWithFieldErrors() throws Exception {
        mockMvc.perform(postJson("/api/auth/signup", Map.of("username", "ab", "email", "nope", "password", "short")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void loginBeforeConfirmationIsForbidden() throws Exception {
        signup(EMAIL);

        mockMvc.perform(postJson("/api/auth/login", Map.of("email", EMAIL, "password", PASSWORD)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("EMAIL_NOT_VERIFIED"));
    }

    @Test
    void confirmLoginAndFetchProfile() throws Exception {
        signup(EMAIL);

        mockMvc.perform(get("/api/auth/confirmed_email/" + jwtTokenService.issueEmailVerification(EMAIL)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Email confirmed"));

        JsonNode tokens = login();
        assertThat(tokens.path("tokenType").asText()).isEqualTo("bearer");

        mockMvc.perform(get("/api/auth/me").header("Authorization", "Bearer " + tokens.path("accessToken").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(EMAIL))
                .andExpect(jsonPath("$.verified").value(true));
    }

    @Test
    void wrongPasswordAndUnknownEmailProduceIdenticalResponses() throws Exception {
        signupAndConfirm();

        String wrongPassword = mockMvc.perform(postJson("/api/auth/login", Map.of("email", EMAIL, "password", "wrong-password")))
                .andExpect(status().isUnauthorized())
                .andReturn().getResponse().getContentAsString();
        String unknownEmail = mockMvc.perform(postJson("/api/auth/login", Map.of("email", "nobody@example.com", "password", PASSWORD)))
                .andExpect(status().isUnauthorized())
                .andReturn().getResponse().getContentAsString();

        assertThat(wrongPassword).isEqualTo(unknownEmail);
        assertThat(objectMapper.readTree(wrongPassword).path("code").asText()).isEqualTo("INVALID_CREDENTIALS");
    }

    @Test
    void refreshRotationAndReplayDetection() throws Exception {
        signupAndConfirm();
        String a = login().path("refreshToken").asText();

        String b = refresh(a).path("refreshToken").asText();
        String c = refresh(b).path("refreshToken").asText();
        assertThat(c).isNotEqualTo(b);

        mockMvc.perform(postJson("/api/auth/refresh_token", Map.of("refreshToken", a)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("REFRESH_REUSE_DETECTED"));
        assertThat(appUserRepository.findByEmail(EMAIL).orElseThrow().getRefreshTokenFingerprint()).isNull();

        mockMvc.perform(postJson("/api/auth/refresh_token", Map.of("refreshToken", c)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void concurrentRefreshWithSameTokenHasExactlyOneWinnerInDatabase() throws Exception {
        signupAndConfirm();
        RefreshRequest request = new RefreshRequest(login().path("refreshToken").asText());
        int contenders = 6;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        try {
            List<Future<TokenPairResponse>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return authService.refresh(request);
                }));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<TokenPairResponse> result : results) {
                try {
                    result.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException ex) {
                    assertThat(ex.getCause()).isInstanceOf(AuthException.class);
                    assertThat(((AuthException) ex.getCause()).getErrorCode())
                            .isEqualTo(AuthErrorCode.REFRESH_REUSE_DETECTED);
                }
            }
            assertThat(succeeded).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
        assertThat(appUserRepository.findByEmail(EMAIL).orElseThrow().getRefreshTokenFingerprint()).isNull();
    }

    @Test
    void accessTokenCannotBeUsedAsRefreshToken() throws Exception {
        signupAndConfirm();
        String access = login().path("accessToken").asText();

        mockMvc.perform(postJson("/api/auth/refresh_token", Map.of("refreshToken", access)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TOKEN_TYPE_MISMATCH"));
    }

    @Test
    void logoutEndsRefreshSessionButNotAccessToken() throws Exception {
        signupAndConfirm();
        JsonNode tokens = login();
        String bearer = "Bearer " + tokens.path("accessToken").asText();

        mockMvc.perform(post("/api/auth/logout").header("Authorization", bearer))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/auth/me").header("Authorization", bearer))
                .andExpect(status().isOk());
        mockMvc.perform(postJson("/api/auth/refresh_token", Map.of("refreshToken", tokens.path("refreshToken").asText())))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void protectedRouteWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        mockMvc.perform(get("/api/auth/me").header("Authorization", "Bearer not-a-token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    @Test
    void resendVerificationIsRateLimited() throws Exception {
        Map<String, String> body = Map.of("email", "someone@example.com");
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(postJson("/api/auth/request_email", body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Check your email for confirmation."));
        }

        mockMvc.perform(postJson("/api/auth/request_email", body))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"));
    }

    @Test
    void healthCheckerAnswersWithoutAuthentication() throws Exception {
        mockMvc.perform(get("/api/healthchecker"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Server alive."));
        mockMvc.perform(get("/readyz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    private void signup(String email) throws Exception {
        mockMvc.perform(postJson("/api/auth/signup", signupBody(email)))
                .andExpect(status().isCreated());
    }

    private void signupAndConfirm() throws Exception {
        signup(EMAIL);
        mockMvc.perform(get("/api/auth/confirmed_email/" + jwtTokenService.issueEmailVerification(EMAIL)))
                .andExpect(status().isOk());
    }

    private JsonNode login() throws Exception {
        MvcResult result = mockMvc.perform(postJson("/api/auth/login", Map.of("email", EMAIL, "password", PASSWORD)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private JsonNode refresh(String refreshToken) throws Exception {
        MvcResult result = mockMvc.perform(postJson("/api/auth/refresh_token", Map.of("refreshToken", refreshToken)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private Map<String, String> signupBody(String email) {
        return Map.of("username", "grace.hopper", "email", email, "password", PASSWORD);
    }

    private MockHttpServletRequestBuilder postJson(String path, Object body) throws Exception {
        return post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body));
    }
}
