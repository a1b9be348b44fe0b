package com.weatherdash.backend.auth.support;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;

public final class SecureToken {

    private static final SecureRandom SR = new SecureRandom();

    private SecureToken() {
    }

    /** {@code bytes} random bytes as lower-case hex (64 bytes → 128 chars). */
    public static String newTokenHex(int bytes) {
        byte[] buf = new byte[bytes];
        SR.nextBytes(buf);
        return HexFormat.of().formatHex(buf);
    }

    /** Uniform over 000000..999999, zero-padded. */
    public static String newSixDigitCode() {
        return String.format(Locale.ROOT, "%06d", SR.nextInt(1_000_000));
    }
}
