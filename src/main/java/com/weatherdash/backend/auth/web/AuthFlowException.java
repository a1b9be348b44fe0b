package com.weatherdash.backend.auth.web;

public class AuthFlowException extends RuntimeException {

    private final AuthError error;

    public AuthFlowException(AuthError error) {
        this(error, error.defaultMessage());
    }

    public AuthFlowException(AuthError error, String message) {
        super(message);
        this.error = error;
    }

    public AuthError getError() {
        return error;
    }
}
