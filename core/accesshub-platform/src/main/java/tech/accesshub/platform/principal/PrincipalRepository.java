package tech.accesshub.platform.principal;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Principal entities.
 */
public interface PrincipalRepository {

    // Read operations
    Optional<Principal> findOptional(String id);
    Optional<Principal> findByExternalSubjectId(String externalSubjectId);
    Optional<Principal> findByEmail(String email);
    List<Principal> listAllPrincipals();

    // Write operations
    void persist(Principal principal);
    void update(Principal principal);
}
