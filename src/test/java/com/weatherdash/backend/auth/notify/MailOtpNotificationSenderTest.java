package com.weatherdash.backend.auth.notify;

import com.weatherdash.backend.auth.config.EmailProperties;
import com.weatherdash.backend.auth.config.OtpProperties;
import com.weatherdash.backend.auth.otp.OtpPurpose;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;

class MailOtpNotificationSenderTest {

    private JavaMailSender mail;
    private EmailProperties emailProps;
    private MailOtpNotificationSender sender;

    @BeforeEach
    void setUp() {
        mail = Mockito.mock(JavaMailSender.class);
        emailProps = new EmailProperties();
        sender = new MailOtpNotificationSender(mail, emailProps, new OtpProperties());
    }

    @Test
    void registration_mail_carries_code_and_expiry() {
        assertThat(sender.send("new@example.com", OtpPurpose.REGISTRATION, "048213", "alice")).isTrue();

        ArgumentCaptor<SimpleMailMessage> msg = ArgumentCaptor.forClass(SimpleMailMessage.class);
        Mockito.verify(mail).send(msg.capture());
        assertThat(msg.getValue().getTo()).containsExactly("new@example.com");
        assertThat(msg.getValue().getSubject()).isEqualTo("Email Verification Code - Weather Dashboard");
        assertThat(msg.getValue().getText())
                .contains("Hi alice!")
                .contains("048213")
                .contains("expire in 5 minutes");
    }

    @Test
    void reset_mail_has_its_own_subject() {
        assertThat(MailOtpNotificationSender.subject(OtpPurpose.PASSWORD_RESET))
                .isEqualTo("Password Reset Code - Weather Dashboard");
    }

    @Test
    void smtp_failure_reports_not_delivered() {
        Mockito.doThrow(new MailSendException("connection refused"))
                .when(mail).send(any(SimpleMailMessage.class));

        assertThat(sender.send("new@example.com", OtpPurpose.PASSWORD_RESET, "123456", "alice")).isFalse();
    }

    @Test
    void disabled_delivery_never_touches_smtp() {
        emailProps.setEnabled(false);

        assertThat(sender.send("new@example.com", OtpPurpose.REGISTRATION, "123456", "alice")).isFalse();
        Mockito.verifyNoInteractions(mail);
    }
}
