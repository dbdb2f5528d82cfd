package tech.accesshub.platform.authentication.oauth;

/**
 * Values of the {@code token_type_hint} revocation parameter (RFC 7009 section 2.1).
 */
public enum TokenTypeHint {
    ACCESS_TOKEN,
    REFRESH_TOKEN;

    /**
     * Parse a hint. Unknown or missing hints default to {@link #REFRESH_TOKEN}.
     */
    public static TokenTypeHint parse(String hint) {
        if ("access_token".equals(hint)) {
            return ACCESS_TOKEN;
        }
        return REFRESH_TOKEN;
    }
}
