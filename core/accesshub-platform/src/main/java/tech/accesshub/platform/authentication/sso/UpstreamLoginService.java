package tech.accesshub.platform.authentication.sso;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accesshub.platform.authentication.JwtKeyService;
import tech.accesshub.platform.principal.Principal;

/**
 * Entry point for the SSO callback: verifies the upstream code, provisions the principal,
 * and opens a portal session.
 */
@ApplicationScoped
public class UpstreamLoginService {

    private static final Logger LOG = Logger.getLogger(UpstreamLoginService.class);

    @Inject
    IdentityProvisioner identityProvisioner;

    @Inject
    PrincipalProvisioningService provisioningService;

    @Inject
    UpstreamDiscoveryCache discoveryCache;

    @Inject
    JwtKeyService jwtKeyService;

    /**
     * The upstream provider's endpoints, for building the outbound login redirect.
     */
    public UpstreamDiscoveryDocument discovery() {
        return discoveryCache.current();
    }

    /**
     * @throws UpstreamIdentityException if the code cannot be verified or the principal is deactivated
     */
    public LoginResult completeLogin(String upstreamCode) {
        if (upstreamCode == null || upstreamCode.isBlank()) {
            throw new UpstreamIdentityException("Missing upstream authorization code");
        }

        VerifiedIdentity identity = identityProvisioner.verify(upstreamCode);
        Principal principal = provisioningService.provision(identity);
        String sessionToken = jwtKeyService.issueSessionToken(principal.id);

        LOG.infof("Principal %s signed in via upstream identity provider", principal.id);
        return new LoginResult(principal, sessionToken);
    }
}
