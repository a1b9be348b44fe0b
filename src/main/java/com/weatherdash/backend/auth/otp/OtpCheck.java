package com.weatherdash.backend.auth.otp;

/**
 * Outcome of checking a submitted code against the newest record for (email, purpose).
 * Only {@link #VERIFIED} lets a flow continue; callers surface everything else as the
 * same generic error.
 */
public enum OtpCheck {
    VERIFIED,
    NOT_FOUND,
    ALREADY_CONSUMED,
    EXPIRED,
    MISMATCH;

    public boolean isVerified() {
        return this == VERIFIED;
    }
}
