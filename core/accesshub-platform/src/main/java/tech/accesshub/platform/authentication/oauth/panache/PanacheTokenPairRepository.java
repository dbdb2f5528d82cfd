package tech.accesshub.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.accesshub.platform.authentication.oauth.TokenPair;
import tech.accesshub.platform.authentication.oauth.TokenPairRepository;
import tech.accesshub.platform.authentication.oauth.entity.TokenPairEntity;
import tech.accesshub.platform.authentication.oauth.mapper.TokenPairMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of TokenPairRepository.
 */
@ApplicationScoped
public class PanacheTokenPairRepository
    implements TokenPairRepository, PanacheRepositoryBase<TokenPairEntity, String> {

    @Override
    public Optional<TokenPair> findOptional(String id) {
        return Optional.ofNullable(findById(id)).map(TokenPairMapper::toDomain);
    }

    @Override
    public Optional<TokenPair> findByRefreshTokenHash(String refreshTokenHash) {
        return find("refreshTokenHash", refreshTokenHash)
            .firstResultOptional()
            .map(TokenPairMapper::toDomain);
    }

    @Override
    public void persist(TokenPair pair) {
        persist(TokenPairMapper.toEntity(pair));
    }

    @Override
    public boolean revoke(String id, Instant revokedAt, String replacedBy) {
        return update("revokedAt = ?1, replacedBy = ?2 where id = ?3 and revokedAt is null",
            revokedAt, replacedBy, id) == 1;
    }

    @Override
    public long revokeLineage(String lineageId, Instant revokedAt) {
        return update("revokedAt = ?1 where lineageId = ?2 and revokedAt is null", revokedAt, lineageId);
    }

    @Override
    public long deleteRefreshExpiredBefore(Instant cutoff) {
        return delete("refreshExpiresAt < ?1", cutoff);
    }
}
