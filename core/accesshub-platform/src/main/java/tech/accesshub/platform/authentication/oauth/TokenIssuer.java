package tech.accesshub.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.accesshub.platform.application.Application;
import tech.accesshub.platform.authentication.AuthConfig;
import tech.accesshub.platform.authentication.JwtKeyService;
import tech.accesshub.platform.shared.EntityType;
import tech.accesshub.platform.shared.SecureTokens;
import tech.accesshub.platform.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mints access and refresh token pairs.
 */
@ApplicationScoped
public class TokenIssuer {

    private static final Logger LOG = Logger.getLogger(TokenIssuer.class);
    private static final int REFRESH_TOKEN_BYTES = 32;

    @Inject
    TokenPairRepository pairRepo;

    @Inject
    JwtKeyService jwtKeyService;

    @Inject
    AuthConfig authConfig;

    @Inject
    Clock clock;

    /**
     * Issue the first pair of a new lineage.
     */
    @Transactional
    public IssuedTokens issue(String subjectId, Application application, Set<String> scopes) {
        return issue(newPairId(), subjectId, application, scopes, TsidGenerator.generate(EntityType.TOKEN_LINEAGE));
    }

    /**
     * Issue a pair with a pre-allocated id into an existing lineage.
     */
    @Transactional
    public IssuedTokens issue(String pairId, String subjectId, Application application,
            Set<String> scopes, String lineageId) {
        Instant now = clock.instant();
        String refreshToken = SecureTokens.randomUrlSafe(REFRESH_TOKEN_BYTES);

        TokenPair pair = new TokenPair();
        pair.id = pairId;
        pair.refreshTokenHash = SecureTokens.sha256Hex(refreshToken);
        pair.lineageId = lineageId;
        pair.subjectId = subjectId;
        pair.applicationId = application.id;
        pair.scopes = new LinkedHashSet<>(scopes);
        pair.issuedAt = now;
        pair.expiresAt = now.plus(authConfig.jwt().accessTokenExpiry());
        pair.refreshExpiresAt = now.plus(authConfig.jwt().refreshTokenExpiry());
        pairRepo.persist(pair);

        String scope = Scopes.format(pair.scopes);
        String accessToken = jwtKeyService.issueAccessToken(
            pair.id, subjectId, application.clientId, scope, pair.issuedAt, pair.expiresAt);

        LOG.infof("Token pair %s issued for principal %s, application %s", pair.id, subjectId, application.id);
        return new IssuedTokens(
            pair.id,
            accessToken,
            refreshToken,
            authConfig.jwt().accessTokenExpiry().toSeconds(),
            scope);
    }

    public String newPairId() {
        return TsidGenerator.generate(EntityType.TOKEN_PAIR);
    }
}
