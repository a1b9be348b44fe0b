package com.weatherdash.backend.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * app.otp.*
 */
@Data
@ConfigurationProperties(prefix = "app.otp")
public class OtpProperties {

    /** How long an issued code stays valid. */
    private Duration ttl = Duration.ofMinutes(5);
}
