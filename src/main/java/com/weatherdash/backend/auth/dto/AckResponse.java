package com.weatherdash.backend.auth.dto;

public record AckResponse(boolean success, String message) {}
