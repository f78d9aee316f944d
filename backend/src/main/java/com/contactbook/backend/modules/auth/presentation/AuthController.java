package com.contactbook.backend.modules.auth.presentation;

import com.contactbook.backend.global.security.JwtAuthenticationPrincipal;
import com.contactbook.backend.global.security.SecurityUtils;
import com.contactbook.backend.modules.auth.application.AuthService;
import com.contactbook.backend.modules.auth.presentation.dto.LoginRequest;
import com.contactbook.backend.modules.auth.presentation.dto.MessageResponse;
import com.contactbook.backend.modules.auth.presentation.dto.RefreshRequest;
import com.contactbook.backend.modules.auth.presentation.dto.ResendVerificationRequest;
import com.contactbook.backend.modules.auth.presentation.dto.SignupRequest;
import com.contactbook.backend.modules.auth.presentation.dto.SignupResponse;
import com.contactbook.backend.modules.auth.presentation.dto.TokenPairResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/signup")
    public ResponseEntity<SignupResponse> signup(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/login")
    public ResponseEntity<TokenPairResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/refresh_token")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout() {
        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        authService.logout(principal.userId(), principal.accessToken());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/confirmed_email/{token}")
    public ResponseEntity<MessageResponse> confirmEmail(@PathVariable("token") String token) {
        return ResponseEntity.ok(authService.verifyEmail(token));
    }

    @PostMapping("/request_email")
    public ResponseEntity<MessageResponse> requestEmail(@Valid @RequestBody ResendVerificationRequest request) {
        return ResponseEntity.ok(authService.resendVerification(request));
    }
}
