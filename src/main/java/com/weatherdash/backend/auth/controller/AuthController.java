package com.weatherdash.backend.auth.controller;

import com.weatherdash.backend.auth.dto.AuthResponse;
import com.weatherdash.backend.auth.dto.LoginRequest;
import com.weatherdash.backend.auth.dto.RefreshRequest;
import com.weatherdash.backend.auth.dto.UserSummary;
import com.weatherdash.backend.auth.security.AuthContext;
import com.weatherdash.backend.auth.service.SessionAuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final SessionAuthService sessions;
    private final AuthContext authContext;

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest body) {
        return ResponseEntity.ok(sessions.login(body));
    }

    @PostMapping("/refresh")
    public ResponseEntity<AuthResponse> refresh(@RequestBody RefreshRequest body) {
        return ResponseEntity.ok(sessions.refresh(body.refreshToken()));
    }

    /** Always 204, whether or not the token was still known. */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@RequestBody(required = false) RefreshRequest body) {
        if (body != null) {
            sessions.logout(body.refreshToken());
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/profile")
    public ResponseEntity<UserSummary> profile() {
        return ResponseEntity.ok(sessions.profile(authContext.requireUserId()));
    }
}
