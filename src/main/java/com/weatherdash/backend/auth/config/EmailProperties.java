package com.weatherdash.backend.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * app.email.*
 */
@Data
@ConfigurationProperties(prefix = "app.email")
public class EmailProperties {

    /** When false no mail is handed to SMTP; codes are only reachable through the log side channel. */
    private boolean enabled = true;

    private String sender = "no-reply@weatherdash.app";

    private String senderName = "Weather Dashboard";

    /** Dev/test only: log undelivered plaintext codes. Never enable in production. */
    private boolean logCodes = false;
}
