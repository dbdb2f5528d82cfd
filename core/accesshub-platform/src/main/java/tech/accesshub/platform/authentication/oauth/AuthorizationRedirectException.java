package tech.accesshub.platform.authentication.oauth;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An authorization request rejected after the client and redirect URI were validated.
 * The error travels back to the client on its redirect URI instead of in a response body.
 */
public class AuthorizationRedirectException extends OAuthException {

    private final String redirectUri;
    private final String state;

    public AuthorizationRedirectException(OAuthError error, String reason, String redirectUri, String state) {
        super(error, reason);
        this.redirectUri = redirectUri;
        this.state = state;
    }

    public URI location() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("error", getError().code());
        if (state != null) {
            params.put("state", state);
        }
        return CallbackUrl.withParameters(redirectUri, params);
    }
}
