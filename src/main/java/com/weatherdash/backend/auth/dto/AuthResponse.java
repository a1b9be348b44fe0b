package com.weatherdash.backend.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthResponse(
        UserSummary user,             // absent on refresh
        String accessToken,
        String refreshToken,
        String tokenType,             // always "Bearer"
        Long   accessExpiresInSec,
        Long   refreshExpiresInSec,
        Long   serverTimeEpochSec
) {}
