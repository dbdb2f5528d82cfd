package tech.accesshub.platform.group.mapper;

import tech.accesshub.platform.group.AccessGroup;
import tech.accesshub.platform.group.entity.AccessGroupEntity;

import java.util.LinkedHashSet;

/**
 * Mapper for converting between AccessGroup domain model and JPA entity.
 */
public final class AccessGroupMapper {

    private AccessGroupMapper() {
    }

    public static AccessGroup toDomain(AccessGroupEntity entity) {
        if (entity == null) {
            return null;
        }

        AccessGroup domain = new AccessGroup();
        domain.id = entity.id;
        domain.name = entity.name;
        domain.description = entity.description;
        domain.color = entity.color;
        domain.memberIds = entity.memberIds != null ? new LinkedHashSet<>(entity.memberIds) : new LinkedHashSet<>();
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static AccessGroupEntity toEntity(AccessGroup domain) {
        if (domain == null) {
            return null;
        }

        AccessGroupEntity entity = new AccessGroupEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(AccessGroupEntity entity, AccessGroup domain) {
        entity.name = domain.name;
        entity.description = domain.description;
        entity.color = domain.color != null ? domain.color : AccessGroup.DEFAULT_COLOR;
        entity.memberIds.clear();
        if (domain.memberIds != null) {
            entity.memberIds.addAll(domain.memberIds);
        }
        entity.updatedAt = domain.updatedAt;
    }
}
