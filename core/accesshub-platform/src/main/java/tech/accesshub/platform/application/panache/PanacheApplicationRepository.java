package tech.accesshub.platform.application.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.accesshub.platform.application.Application;
import tech.accesshub.platform.application.ApplicationRepository;
import tech.accesshub.platform.application.entity.ApplicationEntity;
import tech.accesshub.platform.application.mapper.ApplicationMapper;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of ApplicationRepository.
 */
@ApplicationScoped
public class PanacheApplicationRepository
    implements ApplicationRepository, PanacheRepositoryBase<ApplicationEntity, String> {

    @Override
    public Optional<Application> findOptional(String id) {
        return Optional.ofNullable(findById(id)).map(ApplicationMapper::toDomain);
    }

    @Override
    public Optional<Application> findByClientId(String clientId) {
        return find("clientId", clientId)
            .firstResultOptional()
            .map(ApplicationMapper::toDomain);
    }

    @Override
    public List<Application> findByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return find("id in ?1", ids)
            .stream()
            .map(ApplicationMapper::toDomain)
            .toList();
    }

    @Override
    public List<Application> findPublicActive() {
        return find("active = true and publicAccess = true order by name")
            .stream()
            .map(ApplicationMapper::toDomain)
            .toList();
    }

    @Override
    public boolean existsBySlug(String slug) {
        return count("slug", slug) > 0;
    }

    @Override
    public void persist(Application application) {
        persist(ApplicationMapper.toEntity(application));
    }

    @Override
    public void update(Application application) {
        ApplicationEntity entity = findById(application.id);
        if (entity != null) {
            ApplicationMapper.updateEntity(entity, application);
        }
    }

    @Override
    public boolean updateSecretHash(String id, String clientSecretHash, Instant updatedAt) {
        return update("clientSecretHash = ?1, updatedAt = ?2 where id = ?3",
            clientSecretHash, updatedAt, id) == 1;
    }
}
