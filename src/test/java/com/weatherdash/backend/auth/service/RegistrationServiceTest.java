package com.weatherdash.backend.auth.service;

import com.weatherdash.backend.auth.dto.CompleteRegistrationRequest;
import com.weatherdash.backend.auth.dto.RegistrationCodeRequest;
import com.weatherdash.backend.auth.entity.User;
import com.weatherdash.backend.auth.otp.OtpCheck;
import com.weatherdash.backend.auth.otp.OtpIssuer;
import com.weatherdash.backend.auth.otp.OtpPurpose;
import com.weatherdash.backend.auth.otp.OtpVerifier;
import com.weatherdash.backend.auth.repo.UserRepo;
import com.weatherdash.backend.auth.web.AuthError;
import com.weatherdash.backend.auth.web.AuthFlowException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;

class RegistrationServiceTest {

    private UserRepo users;
    private OtpIssuer issuer;
    private OtpVerifier verifier;
    private TokenService tokens;
    private RegistrationService svc;

    @BeforeEach
    void setUp() {
        users = Mockito.mock(UserRepo.class);
        issuer = Mockito.mock(OtpIssuer.class);
        verifier = Mockito.mock(OtpVerifier.class);
        tokens = Mockito.mock(TokenService.class);
        PasswordEncoder encoder = Mockito.mock(PasswordEncoder.class);
        Mockito.when(encoder.encode(anyString())).thenReturn("$2a$hash");
        svc = new RegistrationService(users, issuer, verifier, encoder, tokens);
    }

    private static CompleteRegistrationRequest completeReq() {
        return new CompleteRegistrationRequest("new@example.com", "123456", "alice", "Str0ngPass!");
    }

    @Test
    void code_for_registered_email_is_refused_without_issuing() {
        Mockito.when(users.existsByEmailIgnoreCase("new@example.com")).thenReturn(true);

        assertThatThrownBy(() -> svc.requestCode(new RegistrationCodeRequest("New@Example.com", null)))
                .extracting(e -> ((AuthFlowException) e).getError())
                .isEqualTo(AuthError.DUPLICATE_EMAIL);
        Mockito.verifyNoInteractions(issuer);
    }

    @Test
    void weak_password_is_refused_before_touching_the_code() {
        var req = new CompleteRegistrationRequest("new@example.com", "123456", "alice", "weak");

        assertThatThrownBy(() -> svc.complete(req))
                .extracting(e -> ((AuthFlowException) e).getError())
                .isEqualTo(AuthError.WEAK_PASSWORD);
        Mockito.verifyNoInteractions(verifier);
    }

    @Test
    void rejected_code_creates_no_account() {
        Mockito.when(verifier.verifyAndConsume("new@example.com", "123456", OtpPurpose.REGISTRATION))
                .thenReturn(OtpCheck.MISMATCH);

        assertThatThrownBy(() -> svc.complete(completeReq()))
                .extracting(e -> ((AuthFlowException) e).getError())
                .isEqualTo(AuthError.INVALID_OR_EXPIRED_CODE);
        Mockito.verify(users, Mockito.never()).saveAndFlush(any());
    }

    @Test
    void unique_constraint_race_maps_to_already_registered() {
        Mockito.when(verifier.verifyAndConsume("new@example.com", "123456", OtpPurpose.REGISTRATION))
                .thenReturn(OtpCheck.VERIFIED);
        Mockito.when(users.saveAndFlush(any(User.class)))
                .thenThrow(new DataIntegrityViolationException("uk_users_email"));

        assertThatThrownBy(() -> svc.complete(completeReq()))
                .extracting(e -> ((AuthFlowException) e).getError())
                .isEqualTo(AuthError.ALREADY_REGISTERED);
        Mockito.verifyNoInteractions(tokens);
    }

    @Test
    void email_registered_since_the_code_was_sent_is_already_registered() {
        Mockito.when(verifier.verifyAndConsume("new@example.com", "123456", OtpPurpose.REGISTRATION))
                .thenReturn(OtpCheck.VERIFIED);
        Mockito.when(users.existsByEmailIgnoreCase("new@example.com")).thenReturn(true);

        assertThatThrownBy(() -> svc.complete(completeReq()))
                .extracting(e -> ((AuthFlowException) e).getError())
                .isEqualTo(AuthError.ALREADY_REGISTERED);
        Mockito.verify(users, Mockito.never()).saveAndFlush(any());
        Mockito.verifyNoInteractions(tokens);
    }

    @Test
    void verified_user_is_saved_with_hashed_password() {
        Mockito.when(verifier.verifyAndConsume("new@example.com", "123456", OtpPurpose.REGISTRATION))
                .thenReturn(OtpCheck.VERIFIED);
        Mockito.when(users.saveAndFlush(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            u.setId(1L);
            return u;
        });

        svc.complete(completeReq());

        Mockito.verify(users).saveAndFlush(Mockito.argThat(u ->
                u.isEmailVerified() && "$2a$hash".equals(u.getPasswordHash()) && "alice".equals(u.getUsername())));
        Mockito.verify(verifier).discard("new@example.com", OtpPurpose.REGISTRATION);
        assertThat(Mockito.mockingDetails(tokens).getInvocations()).isNotEmpty();
    }
}
