package com.weatherdash.backend.auth.web;

import org.springframework.http.HttpStatus;

/**
 * Expected, caller-recoverable outcomes of the auth flows. Messages are deliberately
 * generic where a precise one would reveal whether an account or code exists.
 */
public enum AuthError {
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "Validation failed"),
    WEAK_PASSWORD(HttpStatus.BAD_REQUEST,
            "Password must be at least 6 characters and contain an uppercase letter, a lowercase letter and a number"),
    DUPLICATE_EMAIL(HttpStatus.CONFLICT, "Email already registered"),
    DUPLICATE_USERNAME(HttpStatus.CONFLICT, "Username already taken"),
    ALREADY_REGISTERED(HttpStatus.CONFLICT, "User already registered"),
    INVALID_OR_EXPIRED_CODE(HttpStatus.BAD_REQUEST, "Invalid code or it has expired"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid username/email or password"),
    INVALID_OR_EXPIRED_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid or expired refresh token");

    private final HttpStatus status;
    private final String defaultMessage;

    AuthError(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() { return status; }

    public String defaultMessage() { return defaultMessage; }
}
