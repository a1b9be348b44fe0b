package com.weatherdash.backend.auth.service;

import com.weatherdash.backend.auth.config.AuthProperties;
import com.weatherdash.backend.auth.entity.RefreshToken;
import com.weatherdash.backend.auth.entity.User;
import com.weatherdash.backend.auth.repo.RefreshTokenRepo;
import com.weatherdash.backend.auth.repo.UserRepo;
import com.weatherdash.backend.auth.security.AccessTokenService;
import com.weatherdash.backend.auth.web.AuthError;
import com.weatherdash.backend.auth.web.AuthFlowException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;

class TokenServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-10T10:00:00Z");

    private RefreshTokenRepo repo;
    private UserRepo users;
    private AccessTokenService access;
    private TokenService svc;

    @BeforeEach
    void setUp() {
        repo = Mockito.mock(RefreshTokenRepo.class);
        users = Mockito.mock(UserRepo.class);
        access = Mockito.mock(AccessTokenService.class);
        Mockito.when(access.issue(any())).thenReturn("access.jwt");
        Mockito.when(access.ttlSeconds()).thenReturn(900L);
        svc = new TokenService(repo, users, access, new AuthProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static User user() {
        var u = new User();
        u.setId(5L);
        u.setUsername("alice");
        u.setEmail("new@example.com");
        return u;
    }

    private static RefreshToken row(String token) {
        var t = new RefreshToken();
        t.setId(1L);
        t.setToken(token);
        t.setUserId(5L);
        t.setCreatedAt(NOW.minusSeconds(60));
        t.setExpiresAt(NOW.plusSeconds(3600));
        return t;
    }

    @Test
    void issue_stores_opaque_refresh_token_with_ttl() {
        var pair = svc.issue(user());

        ArgumentCaptor<RefreshToken> saved = ArgumentCaptor.forClass(RefreshToken.class);
        Mockito.verify(repo).save(saved.capture());
        assertEquals(pair.refreshToken(), saved.getValue().getToken());
        assertEquals(128, pair.refreshToken().length());
        assertEquals(NOW.plusSeconds(30L * 24 * 3600), saved.getValue().getExpiresAt());
        assertEquals("access.jwt", pair.accessToken());
    }

    @Test
    void rotation_deletes_old_token_and_issues_new_pair() {
        Mockito.when(repo.findByTokenAndExpiresAtAfter("r1", NOW)).thenReturn(Optional.of(row("r1")));
        Mockito.when(repo.deleteActive("r1", NOW)).thenReturn(1);
        Mockito.when(users.findById(5L)).thenReturn(Optional.of(user()));

        var pair = svc.rotateRefresh("r1");

        assertNotEquals("r1", pair.refreshToken());
        Mockito.verify(repo).deleteActive("r1", NOW);
    }

    @Test
    void losing_the_rotation_race_is_rejected() {
        Mockito.when(repo.findByTokenAndExpiresAtAfter("r1", NOW)).thenReturn(Optional.of(row("r1")));
        Mockito.when(repo.deleteActive("r1", NOW)).thenReturn(0);

        var ex = assertThrows(AuthFlowException.class, () -> svc.rotateRefresh("r1"));
        assertEquals(AuthError.INVALID_OR_EXPIRED_TOKEN, ex.getError());
        Mockito.verify(repo, Mockito.never()).save(any());
    }

    @Test
    void unknown_or_blank_token_is_rejected() {
        Mockito.when(repo.findByTokenAndExpiresAtAfter("nope", NOW)).thenReturn(Optional.empty());

        assertEquals(AuthError.INVALID_OR_EXPIRED_TOKEN,
                assertThrows(AuthFlowException.class, () -> svc.rotateRefresh("nope")).getError());
        assertEquals(AuthError.INVALID_OR_EXPIRED_TOKEN,
                assertThrows(AuthFlowException.class, () -> svc.rotateRefresh(" ")).getError());
    }

    @Test
    void revoke_ignores_blank() {
        svc.revoke(null);
        svc.revoke("");
        Mockito.verifyNoInteractions(repo);

        svc.revoke("r1");
        Mockito.verify(repo).deleteByTokenValue("r1");
    }

    @Test
    void refresh_response_omits_user() {
        var res = svc.toResponse(new TokenService.AuthPair("a", "r", NOW), null);

        assertNull(res.user());
        assertEquals("Bearer", res.tokenType());
        assertEquals(900L, res.accessExpiresInSec());
        assertEquals(NOW.getEpochSecond(), res.serverTimeEpochSec());
    }
}
