package com.weatherdash.backend.auth.dto;

public record RefreshRequest(String refreshToken) {}
