package tech.accesshub.platform.authentication.sso;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Used until a deployment supplies its own {@link IdentityProvisioner}. Rejects every login.
 */
@DefaultBean
@ApplicationScoped
public class UnconfiguredIdentityProvisioner implements IdentityProvisioner {

    @Override
    public VerifiedIdentity verify(String upstreamCode) {
        throw new UpstreamIdentityException("No identity provisioner is configured");
    }
}
