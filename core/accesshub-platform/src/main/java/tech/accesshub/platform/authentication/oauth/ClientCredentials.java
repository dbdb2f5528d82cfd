package tech.accesshub.platform.authentication.oauth;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Client credentials presented at the token or revocation endpoint.
 *
 * @param clientId            the presented client_id, may be null
 * @param clientSecret        the presented secret, may be null
 * @param basicAuthentication true when taken from an HTTP Basic header
 */
public record ClientCredentials(String clientId, String clientSecret, boolean basicAuthentication) {

    private static final String BASIC_PREFIX = "Basic ";

    /**
     * Resolve credentials from the Authorization header ({@code client_secret_basic}) or the form
     * fields ({@code client_secret_post}). The header wins when both are present.
     *
     * @throws OAuthException {@code invalid_client} when the Basic header is malformed
     */
    public static ClientCredentials resolve(String authorizationHeader, String formClientId, String formClientSecret) {
        if (authorizationHeader != null && authorizationHeader.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return parseBasic(authorizationHeader);
        }
        return new ClientCredentials(formClientId, formClientSecret, false);
    }

    private static ClientCredentials parseBasic(String authorizationHeader) {
        String decoded;
        try {
            String base64 = authorizationHeader.substring(BASIC_PREFIX.length()).trim();
            decoded = new String(Base64.getDecoder().decode(base64), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw OAuthException.invalidClient("Malformed Basic authorization header", true);
        }
        int colonIdx = decoded.indexOf(':');
        if (colonIdx < 0) {
            throw OAuthException.invalidClient("Basic authorization header without secret", true);
        }
        // RFC 6749 section 2.3.1: both parts are form-urlencoded before Base64
        return new ClientCredentials(
            URLDecoder.decode(decoded.substring(0, colonIdx), StandardCharsets.UTF_8),
            URLDecoder.decode(decoded.substring(colonIdx + 1), StandardCharsets.UTF_8),
            true);
    }

    public boolean isComplete() {
        return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isEmpty();
    }
}
