package tech.accesshub.platform.authentication.oauth;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single-use authorization code.
 *
 * Authorization codes are:
 * - Short-lived (default: 10 minutes)
 * - Single-use ({@code consumedAt} goes from null to set exactly once)
 * - Bound to subject, application, redirect URI, scopes and state
 */
public class AuthorizationCode {

    public String id;

    /**
     * The opaque code value (32 random bytes, base64url).
     */
    public String code;

    public String subjectId;

    public String applicationId;

    /**
     * Redirect URI of the authorization request. Must match exactly at exchange.
     */
    public String redirectUri;

    public Set<String> scopes = new LinkedHashSet<>();

    /**
     * Client-provided state, echoed verbatim.
     */
    public String clientState;

    public Instant issuedAt;

    public Instant expiresAt;

    public Instant consumedAt;

    public AuthorizationCode() {
    }

    public AuthorizationCodeState stateAt(Instant now) {
        if (consumedAt != null) {
            return AuthorizationCodeState.CONSUMED;
        }
        if (!now.isBefore(expiresAt)) {
            return AuthorizationCodeState.EXPIRED;
        }
        return AuthorizationCodeState.PENDING;
    }
}
