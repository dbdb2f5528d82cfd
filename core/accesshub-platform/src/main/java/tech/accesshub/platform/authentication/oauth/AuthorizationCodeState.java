package tech.accesshub.platform.authentication.oauth;

/**
 * Lifecycle of an authorization code. EXPIRED is never stored; it is derived on lookup.
 */
public enum AuthorizationCodeState {
    PENDING,
    CONSUMED,
    EXPIRED
}
