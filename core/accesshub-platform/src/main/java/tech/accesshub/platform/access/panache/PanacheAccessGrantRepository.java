package tech.accesshub.platform.access.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.accesshub.platform.access.AccessGrant;
import tech.accesshub.platform.access.AccessGrantRepository;
import tech.accesshub.platform.access.Grantee;
import tech.accesshub.platform.access.GranteeType;
import tech.accesshub.platform.access.entity.AccessGrantEntity;
import tech.accesshub.platform.access.mapper.AccessGrantMapper;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of AccessGrantRepository.
 */
@ApplicationScoped
public class PanacheAccessGrantRepository
    implements AccessGrantRepository, PanacheRepositoryBase<AccessGrantEntity, String> {

    @Override
    public List<AccessGrant> findByApplicationId(String applicationId) {
        return find("applicationId", applicationId)
            .stream()
            .map(AccessGrantMapper::toDomain)
            .toList();
    }

    @Override
    public Optional<AccessGrant> findByGranteeAndApplication(Grantee grantee, String applicationId) {
        return find("granteeType = ?1 and granteeId = ?2 and applicationId = ?3",
                grantee.type(), grantee.id(), applicationId)
            .firstResultOptional()
            .map(AccessGrantMapper::toDomain);
    }

    @Override
    public List<AccessGrant> findForSubject(String principalId, Collection<String> groupIds) {
        if (groupIds == null || groupIds.isEmpty()) {
            return find("granteeType = ?1 and granteeId = ?2", GranteeType.DIRECT, principalId)
                .stream()
                .map(AccessGrantMapper::toDomain)
                .toList();
        }
        return find("(granteeType = ?1 and granteeId = ?2) or (granteeType = ?3 and granteeId in ?4)",
                GranteeType.DIRECT, principalId, GranteeType.GROUP, groupIds)
            .stream()
            .map(AccessGrantMapper::toDomain)
            .toList();
    }

    @Override
    public void persist(AccessGrant grant) {
        persist(AccessGrantMapper.toEntity(grant));
    }

    @Override
    public long deleteByGranteeAndApplication(Grantee grantee, String applicationId) {
        return delete("granteeType = ?1 and granteeId = ?2 and applicationId = ?3",
            grantee.type(), grantee.id(), applicationId);
    }

    @Override
    public long deleteByGrantee(Grantee grantee) {
        return delete("granteeType = ?1 and granteeId = ?2", grantee.type(), grantee.id());
    }
}
