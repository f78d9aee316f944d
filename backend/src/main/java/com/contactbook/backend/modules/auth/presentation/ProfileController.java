package com.contactbook.backend.modules.auth.presentation;

import com.contactbook.backend.global.security.SecurityUtils;
import com.contactbook.backend.modules.auth.application.AuthService;
import com.contactbook.backend.modules.auth.presentation.dto.UserSummaryResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/api/auth/me")
    public ResponseEntity<UserSummaryResponse> me() {
        return ResponseEntity.ok(authService.loadProfile(SecurityUtils.getCurrentUserId()));
    }
}
