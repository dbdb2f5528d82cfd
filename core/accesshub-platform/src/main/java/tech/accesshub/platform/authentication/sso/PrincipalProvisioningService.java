package tech.accesshub.platform.authentication.sso;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.accesshub.platform.principal.Principal;
import tech.accesshub.platform.principal.PrincipalRepository;
import tech.accesshub.platform.shared.EntityType;
import tech.accesshub.platform.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Creates or refreshes the local principal for a verified upstream identity.
 *
 * Lookup is by upstream subject first. A principal created before its subject was known
 * (e.g. pre-registered by email) is linked on its first login.
 */
@ApplicationScoped
public class PrincipalProvisioningService {

    private static final Logger LOG = Logger.getLogger(PrincipalProvisioningService.class);

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    Clock clock;

    /**
     * @return the active principal for this identity, with its profile and last login refreshed
     * @throws UpstreamIdentityException if the matching principal has been deactivated
     */
    @Transactional
    public Principal provision(VerifiedIdentity identity) {
        Instant now = clock.instant();

        Optional<Principal> existing = principalRepo.findByExternalSubjectId(identity.externalSubjectId())
            .or(() -> principalRepo.findByEmail(identity.email()));

        if (existing.isEmpty()) {
            Principal principal = new Principal();
            principal.id = TsidGenerator.generate(EntityType.PRINCIPAL);
            applyProfile(principal, identity);
            principal.createdAt = now;
            principal.updatedAt = now;
            principal.lastLoginAt = now;
            principalRepo.persist(principal);
            LOG.infof("Provisioned principal %s for upstream subject %s", principal.id, identity.externalSubjectId());
            return principal;
        }

        Principal principal = existing.get();
        if (!principal.active) {
            LOG.warnf("Login rejected for deactivated principal %s", principal.id);
            throw new UpstreamIdentityException("Principal is deactivated");
        }
        if (principal.externalSubjectId != null
                && !principal.externalSubjectId.equals(identity.externalSubjectId())) {
            LOG.warnf("Principal %s matched by email but bound to a different upstream subject", principal.id);
            throw new UpstreamIdentityException("Email is bound to a different upstream identity");
        }

        applyProfile(principal, identity);
        principal.updatedAt = now;
        principal.lastLoginAt = now;
        principalRepo.update(principal);
        LOG.debugf("Refreshed principal %s from upstream identity", principal.id);
        return principal;
    }

    private static void applyProfile(Principal principal, VerifiedIdentity identity) {
        principal.externalSubjectId = identity.externalSubjectId();
        principal.email = identity.email();
        principal.displayName = identity.displayName() != null ? identity.displayName() : identity.email();
        principal.firstName = identity.firstName();
        principal.lastName = identity.lastName();
        principal.department = identity.department();
        principal.jobTitle = identity.jobTitle();
        principal.idpGroups = new ArrayList<>(identity.groupNames());
    }
}
