package tech.accesshub.platform.authentication.oauth;

/**
 * OAuth 2.0 error codes returned by the hub (RFC 6749 section 5.2 and 4.1.2.1).
 */
public enum OAuthError {
    INVALID_REQUEST("invalid_request"),
    INVALID_CLIENT("invalid_client"),
    INVALID_GRANT("invalid_grant"),
    UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type"),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type"),
    ACCESS_DENIED("access_denied");

    private final String code;

    OAuthError(String code) {
        this.code = code;
    }

    /**
     * The wire value placed in the {@code error} field.
     */
    public String code() {
        return code;
    }
}
