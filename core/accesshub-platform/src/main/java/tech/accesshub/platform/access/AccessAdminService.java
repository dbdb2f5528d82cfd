package tech.accesshub.platform.access;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;
import tech.accesshub.platform.application.Application;
import tech.accesshub.platform.application.ApplicationRepository;
import tech.accesshub.platform.group.AccessGroupRepository;
import tech.accesshub.platform.principal.PrincipalRepository;
import tech.accesshub.platform.shared.EntityType;
import tech.accesshub.platform.shared.TsidGenerator;

import java.time.Clock;
import java.util.Optional;

/**
 * Write side of access control: grants, revocations and the public flag.
 */
@ApplicationScoped
public class AccessAdminService {

    private static final Logger LOG = Logger.getLogger(AccessAdminService.class);

    @Inject
    ApplicationRepository applicationRepo;

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    AccessGroupRepository groupRepo;

    @Inject
    AccessGrantRepository grantRepo;

    @Inject
    Clock clock;

    /**
     * Grant a principal or group access to an application.
     * Granting twice returns the existing grant.
     *
     * @param grantedBy principal id of the acting administrator, may be null
     * @throws NotFoundException if the application or grantee does not exist
     */
    @Transactional
    public AccessGrant grant(Grantee grantee, String applicationId, String grantedBy) {
        requireApplication(applicationId);
        requireGrantee(grantee);

        Optional<AccessGrant> existing = grantRepo.findByGranteeAndApplication(grantee, applicationId);
        if (existing.isPresent()) {
            return existing.get();
        }

        AccessGrant grant = new AccessGrant(
            TsidGenerator.generate(EntityType.ACCESS_GRANT),
            grantee,
            applicationId,
            clock.instant(),
            grantedBy);
        grantRepo.persist(grant);

        LOG.infof("Access to application %s granted to %s %s", applicationId, grantee.type(), grantee.id());
        return grant;
    }

    /**
     * Remove a grant.
     *
     * @return true if a grant was removed
     */
    @Transactional
    public boolean revoke(Grantee grantee, String applicationId) {
        long deleted = grantRepo.deleteByGranteeAndApplication(grantee, applicationId);
        if (deleted > 0) {
            LOG.infof("Access to application %s revoked from %s %s", applicationId, grantee.type(), grantee.id());
        }
        return deleted > 0;
    }

    /**
     * Open an application to every principal, or close it back to grants only.
     */
    @Transactional
    public Application setPublic(String applicationId, boolean publicAccess) {
        Application application = requireApplication(applicationId);
        application.publicAccess = publicAccess;
        application.updatedAt = clock.instant();
        applicationRepo.update(application);

        LOG.infof("Application %s public access set to %s", applicationId, publicAccess);
        return application;
    }

    private Application requireApplication(String applicationId) {
        return applicationRepo.findOptional(applicationId)
            .orElseThrow(() -> new NotFoundException("Application not found: " + applicationId));
    }

    private void requireGrantee(Grantee grantee) {
        boolean exists;
        if (grantee instanceof Grantee.Direct direct) {
            exists = principalRepo.findOptional(direct.principalId()).isPresent();
        } else {
            exists = groupRepo.findOptional(grantee.id()).isPresent();
        }
        if (!exists) {
            throw new NotFoundException(grantee.type() + " grantee not found: " + grantee.id());
        }
    }
}
