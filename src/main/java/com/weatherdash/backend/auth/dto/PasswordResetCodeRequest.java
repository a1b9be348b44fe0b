package com.weatherdash.backend.auth.dto;

import jakarta.validation.constraints.NotBlank;

public record PasswordResetCodeRequest(@NotBlank String email) {}
