package tech.accesshub.platform.authentication.sso;

/**
 * The upstream identity provider could not be reached, or sent an unusable assertion.
 * The login fails; the user may retry by starting a new login. The server never retries.
 */
public class UpstreamIdentityException extends RuntimeException {

    public UpstreamIdentityException(String message) {
        super(message);
    }

    public UpstreamIdentityException(String message, Throwable cause) {
        super(message, cause);
    }
}
