package com.weatherdash.backend.auth.security;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.weatherdash.backend.auth.config.AuthProperties;
import com.weatherdash.backend.auth.entity.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues and verifies short-lived HMAC-SHA256 access tokens.
 * <p>
 * Verification is stateless (signature, issuer, expiry). Revocation happens on the refresh
 * side: a revoked session simply cannot mint the next access token.
 */
@Slf4j
@Component
public class AccessTokenService {

    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_EMAIL = "email";

    private final Algorithm algorithm;
    private final JWTVerifier verifier;
    private final String issuer;
    private final long ttlSeconds;
    private final Clock clock;

    public AccessTokenService(AuthProperties props, Clock clock) {
        String secret = props.getJwt().getSecret();
        if (secret == null || secret.length() < 32) {
            throw new IllegalStateException("app.auth.jwt.secret must be at least 32 characters");
        }
        this.algorithm = Algorithm.HMAC256(secret.getBytes(StandardCharsets.UTF_8));
        this.issuer = props.getJwt().getIssuer();
        this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
        this.ttlSeconds = props.getAccessTtl().toSeconds();
        this.clock = clock;
    }

    public String issue(User user) {
        Instant now = clock.instant();
        return JWT.create()
                .withIssuer(issuer)
                .withSubject(String.valueOf(user.getId()))
                .withClaim(CLAIM_USERNAME, user.getUsername())
                .withClaim(CLAIM_EMAIL, user.getEmail())
                .withIssuedAt(now)
                .withExpiresAt(now.plusSeconds(ttlSeconds))
                .sign(algorithm);
    }

    /**
     * @return the token's claims when signature, issuer and expiry all check out
     */
    public Optional<AccessClaims> verify(String token) {
        try {
            DecodedJWT decoded = verifier.verify(token);
            Long userId = Long.valueOf(decoded.getSubject());
            return Optional.of(new AccessClaims(
                    userId,
                    decoded.getClaim(CLAIM_USERNAME).asString(),
                    decoded.getClaim(CLAIM_EMAIL).asString()));
        } catch (JWTVerificationException | NumberFormatException e) {
            log.debug("access token rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public long ttlSeconds() {
        return ttlSeconds;
    }

    public record AccessClaims(Long userId, String username, String email) {}
}
