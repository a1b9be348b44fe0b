package com.weatherdash.backend.auth.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param username optional; checked for availability early and used to greet in the mail
 */
public record RegistrationCodeRequest(
        @NotBlank String email,
        String username
) {}
