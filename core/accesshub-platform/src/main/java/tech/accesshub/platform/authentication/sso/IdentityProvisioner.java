package tech.accesshub.platform.authentication.sso;

/**
 * Speaks the upstream SSO protocol and hands back a verified identity.
 *
 * <p>Implementations redeem the upstream authorization code and validate the resulting assertion.
 * They may use {@link UpstreamDiscoveryCache} to locate the provider's endpoints.
 */
public interface IdentityProvisioner {

    /**
     * @param upstreamCode the code the upstream provider returned to the hub's callback
     * @throws UpstreamIdentityException when the provider is unreachable or the assertion is unusable
     */
    VerifiedIdentity verify(String upstreamCode);
}
