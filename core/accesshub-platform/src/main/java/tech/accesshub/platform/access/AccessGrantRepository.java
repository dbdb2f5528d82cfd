package tech.accesshub.platform.access;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for AccessGrant entities.
 */
public interface AccessGrantRepository {

    // Read operations
    List<AccessGrant> findByApplicationId(String applicationId);
    Optional<AccessGrant> findByGranteeAndApplication(Grantee grantee, String applicationId);

    /**
     * Grants reaching a subject: its direct grants plus the grants of the given groups.
     */
    List<AccessGrant> findForSubject(String principalId, Collection<String> groupIds);

    // Write operations
    void persist(AccessGrant grant);
    long deleteByGranteeAndApplication(Grantee grantee, String applicationId);
    long deleteByGrantee(Grantee grantee);
}
