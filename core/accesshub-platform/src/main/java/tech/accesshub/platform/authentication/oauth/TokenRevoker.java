package tech.accesshub.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.accesshub.platform.application.Application;
import tech.accesshub.platform.authentication.AccessTokenClaims;
import tech.accesshub.platform.authentication.JwtKeyService;
import tech.accesshub.platform.shared.SecureTokens;

import java.time.Clock;
import java.util.Optional;

/**
 * Token revocation (RFC 7009).
 *
 * <p>After the client authenticates, the outcome is the same whether the token was revoked,
 * unknown, already revoked or owned by another client.
 */
@ApplicationScoped
public class TokenRevoker {

    private static final Logger LOG = Logger.getLogger(TokenRevoker.class);

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    TokenPairRepository pairRepo;

    @Inject
    JwtKeyService jwtKeyService;

    @Inject
    Clock clock;

    /**
     * Revoke the pair an access or refresh token belongs to.
     *
     * @param hint which lookup to try first; the other is tried next
     * @return true if a live pair owned by the client was revoked
     */
    @Transactional
    public boolean revoke(String token, TokenTypeHint hint, ClientCredentials credentials) {
        Application application = clientRegistry.authenticate(credentials);
        if (token == null || token.isBlank()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "token is required");
        }

        Optional<TokenPair> pair = hint == TokenTypeHint.ACCESS_TOKEN
            ? findByAccessToken(token).or(() -> findByRefreshToken(token))
            : findByRefreshToken(token).or(() -> findByAccessToken(token));

        if (pair.isEmpty()) {
            LOG.debugf("Revocation by application %s ignored: unknown token", application.id);
            return false;
        }
        if (!application.id.equals(pair.get().applicationId)) {
            LOG.warnf("Application %s tried to revoke pair %s of another application", application.id, pair.get().id);
            return false;
        }

        boolean revoked = pairRepo.revoke(pair.get().id, clock.instant(), null);
        if (revoked) {
            LOG.infof("Token pair %s revoked by application %s", pair.get().id, application.id);
        }
        return revoked;
    }

    private Optional<TokenPair> findByRefreshToken(String token) {
        return pairRepo.findByRefreshTokenHash(SecureTokens.sha256Hex(token));
    }

    private Optional<TokenPair> findByAccessToken(String token) {
        return jwtKeyService.verifyAccessToken(token)
            .map(AccessTokenClaims::tokenId)
            .flatMap(pairRepo::findOptional);
    }
}
