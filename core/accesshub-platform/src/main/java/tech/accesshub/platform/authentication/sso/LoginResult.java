package tech.accesshub.platform.authentication.sso;

import tech.accesshub.platform.principal.Principal;

/**
 * A completed upstream login: the local principal and the portal session token for its cookie.
 */
public record LoginResult(Principal principal, String sessionToken) {
}
