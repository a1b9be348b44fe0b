package com.weatherdash.backend.auth.otp;

import java.time.Instant;

public record OtpIssueResult(boolean delivered, Instant expiresAt) {}
