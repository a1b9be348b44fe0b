package com.weatherdash.backend.auth.controller;

import com.weatherdash.backend.auth.dto.AuthResponse;
import com.weatherdash.backend.auth.dto.CodeSentResponse;
import com.weatherdash.backend.auth.dto.CompleteRegistrationRequest;
import com.weatherdash.backend.auth.dto.RegistrationCodeRequest;
import com.weatherdash.backend.auth.service.RegistrationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth/register")
public class RegistrationController {

    private final RegistrationService service;

    public RegistrationController(RegistrationService service) {
        this.service = service;
    }

    @PostMapping("/code")
    public ResponseEntity<CodeSentResponse> requestCode(@Valid @RequestBody RegistrationCodeRequest req) {
        return ResponseEntity.ok(service.requestCode(req));
    }

    @PostMapping("/complete")
    public ResponseEntity<AuthResponse> complete(@Valid @RequestBody CompleteRegistrationRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.complete(req));
    }
}
