package tech.accesshub.platform.application;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Application entities.
 */
public interface ApplicationRepository {

    // Read operations
    Optional<Application> findOptional(String id);
    Optional<Application> findByClientId(String clientId);
    List<Application> findByIds(Collection<String> ids);
    List<Application> findPublicActive();
    boolean existsBySlug(String slug);

    // Write operations
    void persist(Application application);
    void update(Application application);
    boolean updateSecretHash(String id, String clientSecretHash, Instant updatedAt);
}
