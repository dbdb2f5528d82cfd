package tech.accesshub.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for TokenPair entities.
 */
public interface TokenPairRepository {

    // Read operations
    Optional<TokenPair> findOptional(String id);
    Optional<TokenPair> findByRefreshTokenHash(String refreshTokenHash);

    // Write operations
    void persist(TokenPair pair);

    /**
     * Revoke a pair only if it is not revoked yet, in a single conditional write.
     *
     * @param replacedBy id of the successor pair, or null for a plain revocation
     * @return true for the one caller whose write took effect
     */
    boolean revoke(String id, Instant revokedAt, String replacedBy);

    /**
     * Revoke every live pair of a lineage.
     *
     * @return number of pairs revoked
     */
    long revokeLineage(String lineageId, Instant revokedAt);

    long deleteRefreshExpiredBefore(Instant cutoff);
}
