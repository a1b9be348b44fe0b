package com.weatherdash.backend.auth.support;

import com.weatherdash.backend.auth.web.AuthError;
import com.weatherdash.backend.auth.web.AuthFlowException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shape checks applied before any ledger is touched.
 */
public final class CredentialRules {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9_]{3,50}$");
    private static final Pattern CODE = Pattern.compile("^\\d{6}$");
    private static final Pattern STRONG = Pattern.compile("^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d).{6,}$");

    private CredentialRules() {
    }

    public static String normalizeEmail(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean looksLikeEmail(String value) {
        return value != null && EMAIL.matcher(value).matches();
    }

    /** Trimmed, lower-cased email or {@code VALIDATION_FAILED}. */
    public static String requireEmail(String raw) {
        String email = normalizeEmail(raw);
        if (!looksLikeEmail(email)) {
            throw new AuthFlowException(AuthError.VALIDATION_FAILED, "Please provide a valid email address");
        }
        return email;
    }

    public static String requireUsername(String raw) {
        String username = raw == null ? "" : raw.trim();
        if (!USERNAME.matcher(username).matches()) {
            throw new AuthFlowException(AuthError.VALIDATION_FAILED,
                    "Username must be 3-50 characters of letters, numbers and underscores");
        }
        return username;
    }

    public static String requireCodeShape(String raw) {
        String code = raw == null ? "" : raw.trim();
        if (!CODE.matcher(code).matches()) {
            throw new AuthFlowException(AuthError.VALIDATION_FAILED, "Code must be a 6-digit number");
        }
        return code;
    }

    public static void requireStrongPassword(String password) {
        if (password == null || !STRONG.matcher(password).matches()) {
            throw new AuthFlowException(AuthError.WEAK_PASSWORD);
        }
    }
}
