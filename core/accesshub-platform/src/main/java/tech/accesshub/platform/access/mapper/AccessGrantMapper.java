package tech.accesshub.platform.access.mapper;

import tech.accesshub.platform.access.AccessGrant;
import tech.accesshub.platform.access.Grantee;
import tech.accesshub.platform.access.entity.AccessGrantEntity;

/**
 * Mapper for converting between AccessGrant domain model and JPA entity.
 */
public final class AccessGrantMapper {

    private AccessGrantMapper() {
    }

    public static AccessGrant toDomain(AccessGrantEntity entity) {
        if (entity == null) {
            return null;
        }

        return new AccessGrant(
            entity.id,
            Grantee.of(entity.granteeType, entity.granteeId),
            entity.applicationId,
            entity.grantedAt,
            entity.grantedBy);
    }

    public static AccessGrantEntity toEntity(AccessGrant domain) {
        if (domain == null) {
            return null;
        }

        AccessGrantEntity entity = new AccessGrantEntity();
        entity.id = domain.id;
        entity.granteeType = domain.grantee.type();
        entity.granteeId = domain.grantee.id();
        entity.applicationId = domain.applicationId;
        entity.grantedAt = domain.grantedAt;
        entity.grantedBy = domain.grantedBy;
        return entity;
    }
}
