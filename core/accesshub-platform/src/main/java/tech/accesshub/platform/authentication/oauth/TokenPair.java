package tech.accesshub.platform.authentication.oauth;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An issued access token and its refresh token.
 *
 * The id is the access token's {@code jti}. Only the SHA-256 of the refresh token is stored.
 * Rotation never mutates a pair beyond revoking it: the successor is a new pair in the same lineage.
 */
public class TokenPair {

    public String id;

    public String refreshTokenHash;

    /**
     * Shared by every pair descended from one code exchange.
     */
    public String lineageId;

    public String subjectId;

    public String applicationId;

    public Set<String> scopes = new LinkedHashSet<>();

    public Instant issuedAt;

    /**
     * Access token expiry.
     */
    public Instant expiresAt;

    public Instant refreshExpiresAt;

    public Instant revokedAt;

    /**
     * Id of the pair that replaced this one on rotation.
     */
    public String replacedBy;

    public TokenPair() {
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isAccessExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isRefreshExpired(Instant now) {
        return !now.isBefore(refreshExpiresAt);
    }
}
