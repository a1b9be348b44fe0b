package com.weatherdash.backend.auth.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

/**
 * @param identifier email or username; the web client posts it as "email"
 */
public record LoginRequest(
        @NotBlank @JsonAlias({"email", "username"}) String identifier,
        @NotBlank String password
) {}
