package tech.accesshub.platform.authentication.oauth;

/**
 * An authorization code was presented after it had been consumed, possibly by a concurrent
 * redemption. Answered as {@code invalid_grant} and never retried.
 */
public class CodeReplayException extends OAuthException {

    public CodeReplayException(String reason) {
        super(OAuthError.INVALID_GRANT, reason);
    }
}
