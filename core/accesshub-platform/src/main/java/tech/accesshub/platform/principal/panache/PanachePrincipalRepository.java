package tech.accesshub.platform.principal.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.accesshub.platform.principal.Principal;
import tech.accesshub.platform.principal.PrincipalRepository;
import tech.accesshub.platform.principal.entity.PrincipalEntity;
import tech.accesshub.platform.principal.mapper.PrincipalMapper;

import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of PrincipalRepository.
 */
@ApplicationScoped
public class PanachePrincipalRepository
    implements PrincipalRepository, PanacheRepositoryBase<PrincipalEntity, String> {

    @Override
    public Optional<Principal> findOptional(String id) {
        return Optional.ofNullable(findById(id)).map(PrincipalMapper::toDomain);
    }

    @Override
    public Optional<Principal> findByExternalSubjectId(String externalSubjectId) {
        return find("externalSubjectId", externalSubjectId)
            .firstResultOptional()
            .map(PrincipalMapper::toDomain);
    }

    @Override
    public Optional<Principal> findByEmail(String email) {
        return find("lower(email) = lower(?1)", email)
            .firstResultOptional()
            .map(PrincipalMapper::toDomain);
    }

    @Override
    public List<Principal> listAllPrincipals() {
        return find("order by email")
            .stream()
            .map(PrincipalMapper::toDomain)
            .toList();
    }

    @Override
    public void persist(Principal principal) {
        persist(PrincipalMapper.toEntity(principal));
    }

    @Override
    public void update(Principal principal) {
        PrincipalEntity entity = findById(principal.id);
        if (entity != null) {
            PrincipalMapper.updateEntity(entity, principal);
        }
    }
}
