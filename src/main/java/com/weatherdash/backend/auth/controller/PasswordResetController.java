package com.weatherdash.backend.auth.controller;

import com.weatherdash.backend.auth.dto.AckResponse;
import com.weatherdash.backend.auth.dto.CompletePasswordResetRequest;
import com.weatherdash.backend.auth.dto.PasswordResetCodeRequest;
import com.weatherdash.backend.auth.dto.VerifiedResponse;
import com.weatherdash.backend.auth.dto.VerifyResetCodeRequest;
import com.weatherdash.backend.auth.service.PasswordResetService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth/password-reset")
public class PasswordResetController {

    private final PasswordResetService service;

    public PasswordResetController(PasswordResetService service) {
        this.service = service;
    }

    @PostMapping("/code")
    public ResponseEntity<AckResponse> requestCode(@Valid @RequestBody PasswordResetCodeRequest req) {
        return ResponseEntity.ok(service.requestCode(req));
    }

    @PostMapping("/verify")
    public ResponseEntity<VerifiedResponse> verify(@Valid @RequestBody VerifyResetCodeRequest req) {
        return ResponseEntity.ok(service.verify(req));
    }

    @PostMapping("/complete")
    public ResponseEntity<AckResponse> complete(@Valid @RequestBody CompletePasswordResetRequest req) {
        return ResponseEntity.ok(service.complete(req));
    }
}
