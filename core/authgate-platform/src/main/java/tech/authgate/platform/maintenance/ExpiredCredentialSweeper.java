package tech.authgate.platform.maintenance;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.authgate.platform.authentication.oauth.AuthorizationCodeRepository;
import tech.authgate.platform.authentication.oauth.OAuthTokenRepository;
import tech.authgate.platform.authentication.session.LegacySessionRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodically removes authorization codes, OAuth tokens and legacy sessions that can no
 * longer be used.
 *
 * Codes are kept for a grace period after expiry so a late replay is still recognized as
 * reuse rather than as an unknown code. Tokens stay until a day past their expiry: a revoked
 * refresh token must outlive its own validity for replays to be detected.
 */
@ApplicationScoped
public class ExpiredCredentialSweeper {

    private static final Logger LOG = Logger.getLogger(ExpiredCredentialSweeper.class);

    static final Duration CODE_GRACE = Duration.ofHours(1);
    static final Duration TOKEN_GRACE = Duration.ofDays(1);

    @Inject
    AuthorizationCodeRepository codeRepository;

    @Inject
    OAuthTokenRepository tokenRepository;

    @Inject
    LegacySessionRepository sessionRepository;

    @Inject
    Clock clock;

    @Scheduled(every = "${authgate.maintenance.sweep-interval:15m}", identity = "expired-credential-sweeper",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error sweeping expired credentials");
        }
    }

    @Transactional
    public SweepResult sweep() {
        Instant now = clock.instant();
        long codes = codeRepository.deleteExpired(now.minus(CODE_GRACE));
        long tokens = tokenRepository.deleteExpired(now.minus(TOKEN_GRACE));
        long sessions = sessionRepository.deleteExpired(now);
        if (codes > 0 || tokens > 0 || sessions > 0) {
            LOG.infof("Swept expired credentials: codes=%d, tokens=%d, sessions=%d", codes, tokens, sessions);
        }
        return new SweepResult(codes, tokens, sessions);
    }

    public record SweepResult(long codes, long tokens, long sessions) {}
}
