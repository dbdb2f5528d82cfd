package tech.accesshub.platform.authentication.oauth.mapper;

import tech.accesshub.platform.authentication.oauth.Scopes;
import tech.accesshub.platform.authentication.oauth.TokenPair;
import tech.accesshub.platform.authentication.oauth.entity.TokenPairEntity;

/**
 * Mapper for converting between TokenPair domain model and JPA entity.
 */
public final class TokenPairMapper {

    private TokenPairMapper() {
    }

    public static TokenPair toDomain(TokenPairEntity entity) {
        if (entity == null) {
            return null;
        }

        TokenPair domain = new TokenPair();
        domain.id = entity.id;
        domain.refreshTokenHash = entity.refreshTokenHash;
        domain.lineageId = entity.lineageId;
        domain.subjectId = entity.subjectId;
        domain.applicationId = entity.applicationId;
        domain.scopes = Scopes.parse(entity.scope);
        domain.issuedAt = entity.issuedAt;
        domain.expiresAt = entity.expiresAt;
        domain.refreshExpiresAt = entity.refreshExpiresAt;
        domain.revokedAt = entity.revokedAt;
        domain.replacedBy = entity.replacedBy;
        return domain;
    }

    public static TokenPairEntity toEntity(TokenPair domain) {
        if (domain == null) {
            return null;
        }

        TokenPairEntity entity = new TokenPairEntity();
        entity.id = domain.id;
        entity.refreshTokenHash = domain.refreshTokenHash;
        entity.lineageId = domain.lineageId;
        entity.subjectId = domain.subjectId;
        entity.applicationId = domain.applicationId;
        entity.scope = Scopes.format(domain.scopes);
        entity.issuedAt = domain.issuedAt;
        entity.expiresAt = domain.expiresAt;
        entity.refreshExpiresAt = domain.refreshExpiresAt;
        entity.revokedAt = domain.revokedAt;
        entity.replacedBy = domain.replacedBy;
        return entity;
    }
}
