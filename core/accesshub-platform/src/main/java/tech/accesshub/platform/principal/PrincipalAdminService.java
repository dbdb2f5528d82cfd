package tech.accesshub.platform.principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.List;

/**
 * Administration of provisioned principals: listing, activation and the admin flag.
 * Principals themselves are only created by upstream login.
 */
@ApplicationScoped
public class PrincipalAdminService {

    private static final Logger LOG = Logger.getLogger(PrincipalAdminService.class);

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    Clock clock;

    public List<Principal> listPrincipals() {
        return principalRepo.listAllPrincipals();
    }

    /**
     * @throws NotFoundException if no principal has this id
     */
    public Principal getPrincipal(String principalId) {
        return requirePrincipal(principalId);
    }

    /**
     * Deactivate or reactivate a principal. A deactivated principal can no longer log in,
     * redeem codes, refresh tokens or call userinfo.
     *
     * @param actingPrincipalId the administrator making the change
     * @throws BadRequestException if an administrator tries to deactivate themselves
     * @throws NotFoundException   if no principal has this id
     */
    @Transactional
    public Principal setActive(String actingPrincipalId, String principalId, boolean active) {
        Principal principal = requirePrincipal(principalId);
        if (!active && principal.id.equals(actingPrincipalId)) {
            throw new BadRequestException("Cannot deactivate yourself");
        }
        if (principal.active == active) {
            return principal;
        }

        principal.active = active;
        principal.updatedAt = clock.instant();
        principalRepo.update(principal);

        LOG.infof("Principal %s %s by %s", principal.id, active ? "activated" : "deactivated", actingPrincipalId);
        return principal;
    }

    /**
     * Grant or withdraw portal administration rights.
     *
     * @throws BadRequestException if an administrator tries to remove their own admin status
     * @throws NotFoundException   if no principal has this id
     */
    @Transactional
    public Principal setAdmin(String actingPrincipalId, String principalId, boolean admin) {
        Principal principal = requirePrincipal(principalId);
        if (!admin && principal.id.equals(actingPrincipalId)) {
            throw new BadRequestException("Cannot remove your own admin status");
        }
        if (principal.admin == admin) {
            return principal;
        }

        principal.admin = admin;
        principal.updatedAt = clock.instant();
        principalRepo.update(principal);

        LOG.infof("Principal %s admin status set to %s by %s", principal.id, admin, actingPrincipalId);
        return principal;
    }

    private Principal requirePrincipal(String principalId) {
        return principalRepo.findOptional(principalId)
            .orElseThrow(() -> new NotFoundException("Principal not found: " + principalId));
    }
}
