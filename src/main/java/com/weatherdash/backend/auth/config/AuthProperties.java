package com.weatherdash.backend.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.auth")
public class AuthProperties {

    /** Lifetime of the signed access token. */
    private Duration accessTtl = Duration.ofMinutes(15);

    /** Lifetime of a refresh token row. */
    private Duration refreshTtl = Duration.ofDays(30);

    /** BCrypt work factor for passwords and one-time codes. */
    private int bcryptStrength = 10;

    private Jwt jwt = new Jwt();

    @Data
    public static class Jwt {
        /** HMAC-SHA256 secret, at least 32 characters. */
        private String secret;
        private String issuer = "weatherdash";
    }
}
