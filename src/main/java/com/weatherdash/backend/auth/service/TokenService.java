package com.weatherdash.backend.auth.service;

import com.weatherdash.backend.auth.config.AuthProperties;
import com.weatherdash.backend.auth.dto.AuthResponse;
import com.weatherdash.backend.auth.dto.UserSummary;
import com.weatherdash.backend.auth.entity.RefreshToken;
import com.weatherdash.backend.auth.entity.User;
import com.weatherdash.backend.auth.repo.RefreshTokenRepo;
import com.weatherdash.backend.auth.repo.UserRepo;
import com.weatherdash.backend.auth.security.AccessTokenService;
import com.weatherdash.backend.auth.support.SecureToken;
import com.weatherdash.backend.auth.web.AuthError;
import com.weatherdash.backend.auth.web.AuthFlowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
public class TokenService {

    static final int REFRESH_TOKEN_BYTES = 64;

    private final RefreshTokenRepo repo;
    private final UserRepo users;
    private final AccessTokenService accessTokens;
    private final long refreshTtlSeconds;
    private final Clock clock;

    public TokenService(RefreshTokenRepo repo,
                        UserRepo users,
                        AccessTokenService accessTokens,
                        AuthProperties props,
                        Clock clock) {
        this.repo = repo;
        this.users = users;
        this.accessTokens = accessTokens;
        this.refreshTtlSeconds = props.getRefreshTtl().toSeconds();
        this.clock = clock;
    }

    /** Signs an access token and records a new refresh token for {@code user}. */
    @Transactional
    public AuthPair issue(User user) {
        final Instant now = clock.instant();

        var refresh = new RefreshToken();
        refresh.setToken(SecureToken.newTokenHex(REFRESH_TOKEN_BYTES));
        refresh.setUserId(user.getId());
        refresh.setCreatedAt(now);
        refresh.setExpiresAt(now.plusSeconds(refreshTtlSeconds));
        repo.save(refresh);

        return new AuthPair(accessTokens.issue(user), refresh.getToken(), now);
    }

    /**
     * Exchanges a refresh token for a new pair. The old row is deleted first with a
     * conditional delete; whoever removes it gets the new pair, any other caller presenting
     * the same token fails.
     */
    @Transactional
    public AuthPair rotateRefresh(String oldRefreshToken) {
        if (oldRefreshToken == null || oldRefreshToken.isBlank()) {
            throw new AuthFlowException(AuthError.INVALID_OR_EXPIRED_TOKEN);
        }
        final Instant now = clock.instant();

        var tk = repo.findByTokenAndExpiresAtAfter(oldRefreshToken, now)
                .orElseThrow(() -> new AuthFlowException(AuthError.INVALID_OR_EXPIRED_TOKEN));

        if (repo.deleteActive(oldRefreshToken, now) == 0) {
            log.info("refresh token for user {} already rotated", tk.getUserId());
            throw new AuthFlowException(AuthError.INVALID_OR_EXPIRED_TOKEN);
        }

        User user = users.findById(tk.getUserId())
                .orElseThrow(() -> new AuthFlowException(AuthError.INVALID_OR_EXPIRED_TOKEN));
        return issue(user);
    }

    /** Idempotent: revoking an unknown or already revoked token is not an error. */
    @Transactional
    public void revoke(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) return;
        repo.deleteByTokenValue(refreshToken);
    }

    @Transactional
    public int revokeAll(Long userId) {
        int n = repo.deleteAllByUserId(userId);
        log.info("revoked {} refresh token(s) for user {}", n, userId);
        return n;
    }

    public AuthResponse toResponse(AuthPair pair, User userOrNull) {
        return new AuthResponse(
                userOrNull == null ? null : UserSummary.from(userOrNull),
                pair.accessToken(),
                pair.refreshToken(),
                "Bearer",
                accessTokens.ttlSeconds(),
                refreshTtlSeconds,
                pair.issuedAt().getEpochSecond()
        );
    }

    public record AuthPair(String accessToken, String refreshToken, Instant issuedAt) {}
}
