package tech.accesshub.platform.principal.mapper;

import tech.accesshub.platform.principal.Principal;
import tech.accesshub.platform.principal.entity.PrincipalEntity;

import java.util.ArrayList;

/**
 * Mapper for converting between Principal domain model and JPA entity.
 */
public final class PrincipalMapper {

    private PrincipalMapper() {
    }

    public static Principal toDomain(PrincipalEntity entity) {
        if (entity == null) {
            return null;
        }

        Principal domain = new Principal();
        domain.id = entity.id;
        domain.externalSubjectId = entity.externalSubjectId;
        domain.email = entity.email;
        domain.displayName = entity.displayName;
        domain.firstName = entity.firstName;
        domain.lastName = entity.lastName;
        domain.department = entity.department;
        domain.jobTitle = entity.jobTitle;
        domain.idpGroups = entity.idpGroups != null ? new ArrayList<>(entity.idpGroups) : new ArrayList<>();
        domain.active = entity.active;
        domain.admin = entity.admin;
        domain.lastLoginAt = entity.lastLoginAt;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static PrincipalEntity toEntity(Principal domain) {
        if (domain == null) {
            return null;
        }

        PrincipalEntity entity = new PrincipalEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(PrincipalEntity entity, Principal domain) {
        entity.externalSubjectId = domain.externalSubjectId;
        entity.email = domain.email;
        entity.displayName = domain.displayName;
        entity.firstName = domain.firstName;
        entity.lastName = domain.lastName;
        entity.department = domain.department;
        entity.jobTitle = domain.jobTitle;
        entity.idpGroups.clear();
        if (domain.idpGroups != null) {
            entity.idpGroups.addAll(domain.idpGroups);
        }
        entity.active = domain.active;
        entity.admin = domain.admin;
        entity.lastLoginAt = domain.lastLoginAt;
        entity.updatedAt = domain.updatedAt;
    }
}
