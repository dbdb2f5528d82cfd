package tech.accesshub.platform.authentication;

import java.time.Instant;

/**
 * Verified claims of an OAuth access token issued by this hub.
 *
 * @param tokenId   the {@code jti}, which is also the id of the backing token pair
 * @param subjectId the principal the token was issued to
 * @param clientId  the {@code aud}, the client_id of the application
 * @param scope     space-separated granted scopes
 * @param expiresAt the {@code exp} instant
 */
public record AccessTokenClaims(
    String tokenId,
    String subjectId,
    String clientId,
    String scope,
    Instant expiresAt
) {}
