package com.weatherdash.backend.auth.notify;

import com.weatherdash.backend.auth.config.EmailProperties;
import com.weatherdash.backend.auth.config.OtpProperties;
import com.weatherdash.backend.auth.otp.OtpPurpose;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class MailOtpNotificationSender implements OtpNotificationSender {

    private final JavaMailSender mail;
    private final EmailProperties emailProps;
    private final OtpProperties otpProps;

    public MailOtpNotificationSender(JavaMailSender mail, EmailProperties emailProps, OtpProperties otpProps) {
        this.mail = mail;
        this.emailProps = emailProps;
        this.otpProps = otpProps;
    }

    @Override
    public boolean send(String destination, OtpPurpose purpose, String plaintextCode, String displayName) {
        if (!emailProps.isEnabled()) {
            log.info("email delivery disabled, {} code for {} not sent", purpose, destination);
            logCodeForDev(destination, purpose, plaintextCode);
            return false;
        }

        var msg = new SimpleMailMessage();
        msg.setFrom(emailProps.getSenderName() + " <" + emailProps.getSender() + ">");
        msg.setTo(destination);
        msg.setSubject(subject(purpose));
        msg.setText(body(purpose, plaintextCode, displayName));

        try {
            mail.send(msg);
            log.info("{} code mailed to {}", purpose, destination);
            return true;
        } catch (MailException e) {
            log.warn("{} code mail to {} failed", purpose, destination, e);
            logCodeForDev(destination, purpose, plaintextCode);
            return false;
        }
    }

    private void logCodeForDev(String destination, OtpPurpose purpose, String code) {
        if (emailProps.isLogCodes()) {
            log.info("[DEV] {} code for {}: {}", purpose, destination, code);
        }
    }

    static String subject(OtpPurpose purpose) {
        return switch (purpose) {
            case REGISTRATION -> "Email Verification Code - Weather Dashboard";
            case PASSWORD_RESET -> "Password Reset Code - Weather Dashboard";
        };
    }

    private String body(OtpPurpose purpose, String code, String displayName) {
        String intro = switch (purpose) {
            case REGISTRATION -> "Use this code to verify your email and complete your registration:";
            case PASSWORD_RESET -> "Use this code to reset your password:";
        };
        long minutes = Math.max(1, otpProps.getTtl().toMinutes());
        return "Hi " + displayName + "!\n\n"
                + intro + "\n\n"
                + "    " + code + "\n\n"
                + "This code will expire in " + minutes + " minutes. Never share it with anyone.\n"
                + "If you didn't request this code, please ignore this email.\n";
    }
}
