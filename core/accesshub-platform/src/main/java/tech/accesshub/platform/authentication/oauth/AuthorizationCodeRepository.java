package tech.accesshub.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for AuthorizationCode entities.
 */
public interface AuthorizationCodeRepository {

    // Read operations
    Optional<AuthorizationCode> findByCode(String code);

    // Write operations
    void persist(AuthorizationCode code);

    /**
     * Set {@code consumedAt} only if it is still null, in a single conditional write.
     *
     * @return true for the one caller whose write took effect
     */
    boolean markConsumed(String code, Instant consumedAt);

    long deleteExpiredBefore(Instant cutoff);
}
