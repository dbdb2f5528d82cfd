package tech.accesshub.platform.group.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.accesshub.platform.group.AccessGroup;
import tech.accesshub.platform.group.AccessGroupRepository;
import tech.accesshub.platform.group.entity.AccessGroupEntity;
import tech.accesshub.platform.group.mapper.AccessGroupMapper;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Panache-based implementation of AccessGroupRepository.
 */
@ApplicationScoped
public class PanacheAccessGroupRepository
    implements AccessGroupRepository, PanacheRepositoryBase<AccessGroupEntity, String> {

    @Override
    public Optional<AccessGroup> findOptional(String id) {
        return Optional.ofNullable(findById(id)).map(AccessGroupMapper::toDomain);
    }

    @Override
    public Optional<AccessGroup> findByName(String name) {
        return find("name", name)
            .firstResultOptional()
            .map(AccessGroupMapper::toDomain);
    }

    @Override
    public List<AccessGroup> findByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return find("id in ?1", ids)
            .stream()
            .map(AccessGroupMapper::toDomain)
            .toList();
    }

    @Override
    public List<AccessGroup> listAllGroups() {
        return find("order by name")
            .stream()
            .map(AccessGroupMapper::toDomain)
            .toList();
    }

    @Override
    public Set<String> findGroupIdsByMember(String principalId) {
        List<String> ids = getEntityManager()
            .createQuery("select g.id from AccessGroupEntity g join g.memberIds m where m = :principalId", String.class)
            .setParameter("principalId", principalId)
            .getResultList();
        return new LinkedHashSet<>(ids);
    }

    @Override
    public void persist(AccessGroup group) {
        persist(AccessGroupMapper.toEntity(group));
    }

    @Override
    public void update(AccessGroup group) {
        AccessGroupEntity entity = findById(group.id);
        if (entity != null) {
            AccessGroupMapper.updateEntity(entity, group);
        }
    }

    @Override
    public boolean deleteGroup(String id) {
        return deleteById(id);
    }
}
