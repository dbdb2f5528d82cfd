package tech.accesshub.platform.authentication.oauth;

/**
 * Tokens handed to a client at exchange or refresh. The refresh token exists in plain form only here.
 *
 * @param pairId       id of the persisted token pair
 * @param accessToken  signed JWT
 * @param refreshToken opaque refresh token
 * @param expiresIn    access token lifetime in seconds
 * @param scope        space-separated granted scopes
 */
public record IssuedTokens(
    String pairId,
    String accessToken,
    String refreshToken,
    long expiresIn,
    String scope
) {}
