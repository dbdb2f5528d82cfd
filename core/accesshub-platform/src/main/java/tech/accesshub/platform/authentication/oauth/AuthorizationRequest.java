package tech.accesshub.platform.authentication.oauth;

/**
 * Parameters of a {@code GET /oauth/authorize} request, as received.
 */
public record AuthorizationRequest(
    String responseType,
    String clientId,
    String redirectUri,
    String scope,
    String state
) {}
