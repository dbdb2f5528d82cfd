package tech.accesshub.platform.authentication.oauth.mapper;

import tech.accesshub.platform.authentication.oauth.AuthorizationCode;
import tech.accesshub.platform.authentication.oauth.Scopes;
import tech.accesshub.platform.authentication.oauth.entity.AuthorizationCodeEntity;

/**
 * Mapper for converting between AuthorizationCode domain model and JPA entity.
 */
public final class AuthorizationCodeMapper {

    private AuthorizationCodeMapper() {
    }

    public static AuthorizationCode toDomain(AuthorizationCodeEntity entity) {
        if (entity == null) {
            return null;
        }

        AuthorizationCode domain = new AuthorizationCode();
        domain.id = entity.id;
        domain.code = entity.code;
        domain.subjectId = entity.subjectId;
        domain.applicationId = entity.applicationId;
        domain.redirectUri = entity.redirectUri;
        domain.scopes = Scopes.parse(entity.scope);
        domain.clientState = entity.clientState;
        domain.issuedAt = entity.issuedAt;
        domain.expiresAt = entity.expiresAt;
        domain.consumedAt = entity.consumedAt;
        return domain;
    }

    public static AuthorizationCodeEntity toEntity(AuthorizationCode domain) {
        if (domain == null) {
            return null;
        }

        AuthorizationCodeEntity entity = new AuthorizationCodeEntity();
        entity.id = domain.id;
        entity.code = domain.code;
        entity.subjectId = domain.subjectId;
        entity.applicationId = domain.applicationId;
        entity.redirectUri = domain.redirectUri;
        entity.scope = Scopes.format(domain.scopes);
        entity.clientState = domain.clientState;
        entity.issuedAt = domain.issuedAt;
        entity.expiresAt = domain.expiresAt;
        entity.consumedAt = domain.consumedAt;
        return entity;
    }
}
