package tech.accesshub.platform.authentication.oauth;

/**
 * A rejected OAuth request.
 *
 * <p>The reason is for logs only. Callers receive nothing but the error code, so every rejection
 * cause looks the same from outside.
 */
public class OAuthException extends RuntimeException {

    private static final int BAD_REQUEST = 400;
    private static final int UNAUTHORIZED = 401;

    private final OAuthError error;
    private final int status;
    private final String challenge;

    public OAuthException(OAuthError error, String reason) {
        this(error, reason, BAD_REQUEST, null);
    }

    protected OAuthException(OAuthError error, String reason, int status, String challenge) {
        super(reason);
        this.error = error;
        this.status = status;
        this.challenge = challenge;
    }

    /**
     * Client authentication failed. Clients that authenticated with HTTP Basic get a 401 challenge.
     */
    public static OAuthException invalidClient(String reason, boolean basicAuthentication) {
        if (basicAuthentication) {
            return new OAuthException(OAuthError.INVALID_CLIENT, reason, UNAUTHORIZED, "Basic realm=\"accesshub\"");
        }
        return new OAuthException(OAuthError.INVALID_CLIENT, reason);
    }

    /**
     * A bearer-protected request without acceptable credentials.
     */
    public static OAuthException unauthorizedBearer(OAuthError error, String reason) {
        return new OAuthException(error, reason, UNAUTHORIZED,
            "Bearer realm=\"accesshub\", error=\"" + error.code() + "\"");
    }

    public OAuthError getError() {
        return error;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Value for the {@code WWW-Authenticate} header, or null when none is sent.
     */
    public String getChallenge() {
        return challenge;
    }
}
