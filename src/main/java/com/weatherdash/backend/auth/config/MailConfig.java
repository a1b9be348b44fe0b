package com.weatherdash.backend.auth.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.mail.MailProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

/**
 * Boot only auto-configures a sender when spring.mail.host is set. The OTP sender always
 * needs one, so an unconfigured host still yields a bean whose sends fail and get logged.
 */
@Configuration
@EnableConfigurationProperties(MailProperties.class)
public class MailConfig {

    @Bean
    @ConditionalOnMissingBean
    public JavaMailSender javaMailSender(MailProperties p) {
        var s = new JavaMailSenderImpl();
        s.setHost(p.getHost());
        if (p.getPort() != null) s.setPort(p.getPort());
        s.setUsername(p.getUsername());
        s.setPassword(p.getPassword());
        if (p.getDefaultEncoding() != null) s.setDefaultEncoding(p.getDefaultEncoding().name());
        s.getJavaMailProperties().putAll(p.getProperties());
        return s;
    }
}
