package tech.accesshub.platform.authentication.oauth;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;

/**
 * Purges expired authorization codes and token pairs whose refresh token has expired.
 */
@ApplicationScoped
public class TokenCleanupService {

    private static final Logger LOG = Logger.getLogger(TokenCleanupService.class);

    @Inject
    AuthorizationCodeRepository codeRepo;

    @Inject
    TokenPairRepository pairRepo;

    @Inject
    Clock clock;

    public record CleanupResult(long codesDeleted, long pairsDeleted) {}

    @Transactional
    public CleanupResult purgeExpired() {
        Instant now = clock.instant();
        long codes = codeRepo.deleteExpiredBefore(now);
        long pairs = pairRepo.deleteRefreshExpiredBefore(now);
        if (codes > 0 || pairs > 0) {
            LOG.infof("Purged %d expired authorization code(s) and %d expired token pair(s)", codes, pairs);
        }
        return new CleanupResult(codes, pairs);
    }

    @Scheduled(every = "{accesshub.maintenance.token-cleanup-every}",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    @Transactional
    void scheduledPurge() {
        purgeExpired();
    }
}
