package tech.accesshub.platform.application.mapper;

import tech.accesshub.platform.application.Application;
import tech.accesshub.platform.application.entity.ApplicationEntity;

import java.util.ArrayList;

/**
 * Mapper for converting between Application domain model and JPA entity.
 */
public final class ApplicationMapper {

    private ApplicationMapper() {
    }

    public static Application toDomain(ApplicationEntity entity) {
        if (entity == null) {
            return null;
        }

        Application domain = new Application();
        domain.id = entity.id;
        domain.name = entity.name;
        domain.slug = entity.slug;
        domain.clientId = entity.clientId;
        domain.clientSecretHash = entity.clientSecretHash;
        domain.redirectUris = entity.redirectUris != null ? new ArrayList<>(entity.redirectUris) : new ArrayList<>();
        domain.description = entity.description;
        domain.baseUrl = entity.baseUrl;
        domain.iconUrl = entity.iconUrl;
        domain.active = entity.active;
        domain.publicAccess = entity.publicAccess;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static ApplicationEntity toEntity(Application domain) {
        if (domain == null) {
            return null;
        }

        ApplicationEntity entity = new ApplicationEntity();
        entity.id = domain.id;
        entity.clientId = domain.clientId;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    /**
     * Copy mutable fields onto a managed entity. The client_id and creation time never change.
     */
    public static void updateEntity(ApplicationEntity entity, Application domain) {
        entity.name = domain.name;
        entity.slug = domain.slug;
        entity.clientSecretHash = domain.clientSecretHash;
        entity.redirectUris.clear();
        if (domain.redirectUris != null) {
            entity.redirectUris.addAll(domain.redirectUris);
        }
        entity.description = domain.description;
        entity.baseUrl = domain.baseUrl;
        entity.iconUrl = domain.iconUrl;
        entity.active = domain.active;
        entity.publicAccess = domain.publicAccess;
        entity.updatedAt = domain.updatedAt;
    }
}
