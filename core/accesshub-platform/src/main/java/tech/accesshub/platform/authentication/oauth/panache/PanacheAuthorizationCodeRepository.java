package tech.accesshub.platform.authentication.oauth.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.accesshub.platform.authentication.oauth.AuthorizationCode;
import tech.accesshub.platform.authentication.oauth.AuthorizationCodeRepository;
import tech.accesshub.platform.authentication.oauth.entity.AuthorizationCodeEntity;
import tech.accesshub.platform.authentication.oauth.mapper.AuthorizationCodeMapper;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of AuthorizationCodeRepository.
 */
@ApplicationScoped
public class PanacheAuthorizationCodeRepository
    implements AuthorizationCodeRepository, PanacheRepositoryBase<AuthorizationCodeEntity, String> {

    @Override
    public Optional<AuthorizationCode> findByCode(String code) {
        return find("code", code)
            .firstResultOptional()
            .map(AuthorizationCodeMapper::toDomain);
    }

    @Override
    public void persist(AuthorizationCode authCode) {
        persist(AuthorizationCodeMapper.toEntity(authCode));
    }

    @Override
    public boolean markConsumed(String code, Instant consumedAt) {
        return update("consumedAt = ?1 where code = ?2 and consumedAt is null", consumedAt, code) == 1;
    }

    @Override
    public long deleteExpiredBefore(Instant cutoff) {
        return delete("expiresAt < ?1", cutoff);
    }
}
