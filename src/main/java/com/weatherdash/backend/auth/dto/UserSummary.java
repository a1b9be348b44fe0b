package com.weatherdash.backend.auth.dto;

import com.weatherdash.backend.auth.entity.User;

import java.time.Instant;

public record UserSummary(
        Long id,
        String username,
        String email,
        boolean emailVerified,
        Instant createdAt
) {
    public static UserSummary from(User u) {
        return new UserSummary(u.getId(), u.getUsername(), u.getEmail(), u.isEmailVerified(), u.getCreatedAt());
    }
}
