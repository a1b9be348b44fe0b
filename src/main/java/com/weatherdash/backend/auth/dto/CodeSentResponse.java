package com.weatherdash.backend.auth.dto;

public record CodeSentResponse(boolean sent, boolean delivered, String message) {}
