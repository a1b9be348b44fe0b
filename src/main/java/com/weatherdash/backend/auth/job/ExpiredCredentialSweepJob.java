package com.weatherdash.backend.auth.job;

import com.weatherdash.backend.auth.repo.EmailOtpCodeRepository;
import com.weatherdash.backend.auth.repo.RefreshTokenRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Removes expired one-time codes and refresh tokens. Lookups already reject expired rows,
 * so this only bounds table growth and its cadence is not critical.
 */
@Slf4j
@Component
public class ExpiredCredentialSweepJob {

    private final EmailOtpCodeRepository codes;
    private final RefreshTokenRepo refreshTokens;
    private final Clock clock;

    public ExpiredCredentialSweepJob(EmailOtpCodeRepository codes, RefreshTokenRepo refreshTokens, Clock clock) {
        this.codes = codes;
        this.refreshTokens = refreshTokens;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${app.auth.sweep.fixed-delay:PT15M}",
            initialDelayString = "${app.auth.sweep.initial-delay:PT1M}"
    )
    @Transactional
    public SweepResult sweep() {
        Instant now = clock.instant();
        int otps = codes.deleteExpired(now);
        int tokens = refreshTokens.deleteExpired(now);
        if (otps > 0 || tokens > 0) {
            log.info("credential sweep done. expiredCodes={}, expiredRefreshTokens={}", otps, tokens);
        }
        return new SweepResult(otps, tokens);
    }

    public record SweepResult(int codes, int refreshTokens) {}
}
