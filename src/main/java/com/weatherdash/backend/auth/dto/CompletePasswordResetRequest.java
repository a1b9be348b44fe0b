package com.weatherdash.backend.auth.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

public record CompletePasswordResetRequest(
        @NotBlank String email,
        @NotBlank @JsonAlias("otp") String code,
        @NotBlank String newPassword
) {}
