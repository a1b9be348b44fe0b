package com.weatherdash.backend.auth.otp;

public enum OtpPurpose {
    REGISTRATION,
    PASSWORD_RESET
}
