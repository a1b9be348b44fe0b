package com.weatherdash.backend.auth.dto;

public record VerifiedResponse(boolean verified, String message) {}
