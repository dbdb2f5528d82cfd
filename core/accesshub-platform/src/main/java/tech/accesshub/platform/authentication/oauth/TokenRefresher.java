package tech.accesshub.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.PessimisticLockException;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.accesshub.platform.application.Application;
import tech.accesshub.platform.principal.PrincipalRepository;
import tech.accesshub.platform.shared.SecureTokens;

import java.time.Clock;
import java.time.Instant;

/**
 * Rotates refresh tokens. Every successful refresh revokes the presented pair and issues a
 * successor in the same lineage with the same scopes.
 *
 * <p>The client authenticates before the token is looked up. A refresh token that was already
 * rotated away, presented by the client it belongs to, is treated as stolen: every live pair of
 * its lineage is revoked. That revocation commits even though the request is rejected.
 */
@ApplicationScoped
public class TokenRefresher {

    private static final Logger LOG = Logger.getLogger(TokenRefresher.class);

    @Inject
    TokenPairRepository pairRepo;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    TokenIssuer tokenIssuer;

    @Inject
    Clock clock;

    @Transactional(dontRollbackOn = OAuthException.class)
    public IssuedTokens refresh(String refreshToken, ClientCredentials credentials) {
        Application application = clientRegistry.authenticate(credentials);
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "refresh_token is required");
        }

        TokenPair pair = pairRepo.findByRefreshTokenHash(SecureTokens.sha256Hex(refreshToken))
            .orElseThrow(() -> new OAuthException(OAuthError.INVALID_GRANT, "Unknown refresh token"));
        if (!application.id.equals(pair.applicationId)) {
            throw new OAuthException(OAuthError.INVALID_GRANT,
                "Pair " + pair.id + " was not issued to client " + application.clientId);
        }

        Instant now = clock.instant();
        if (pair.isRevoked()) {
            if (pair.replacedBy != null) {
                revokeLineage(pair, now);
            }
            throw new OAuthException(OAuthError.INVALID_GRANT, "Refresh token of pair " + pair.id + " is revoked");
        }
        if (pair.isRefreshExpired(now)) {
            throw new OAuthException(OAuthError.INVALID_GRANT, "Refresh token of pair " + pair.id + " expired");
        }

        boolean subjectActive = principalRepo.findOptional(pair.subjectId)
            .map(principal -> principal.active)
            .orElse(false);
        if (!subjectActive) {
            throw new OAuthException(OAuthError.INVALID_GRANT, "Principal " + pair.subjectId + " missing or inactive");
        }

        String successorId = tokenIssuer.newPairId();
        if (!rotate(pair, now, successorId)) {
            throw new OAuthException(OAuthError.INVALID_GRANT, "Lost rotation race for pair " + pair.id);
        }

        IssuedTokens issued = tokenIssuer.issue(successorId, pair.subjectId, application, pair.scopes, pair.lineageId);
        LOG.infof("Pair %s rotated to %s", pair.id, successorId);
        return issued;
    }

    private void revokeLineage(TokenPair pair, Instant now) {
        try {
            long revoked = pairRepo.revokeLineage(pair.lineageId, now);
            LOG.warnf("Refresh token reuse detected for pair %s, revoked %d live pair(s) of lineage %s",
                pair.id, revoked, pair.lineageId);
        } catch (PessimisticLockException | LockTimeoutException e) {
            // another transaction on this lineage holds the rows
            LOG.warnf("Refresh token reuse detected for pair %s, lineage %s already being revoked",
                pair.id, pair.lineageId);
        }
    }

    private boolean rotate(TokenPair pair, Instant now, String successorId) {
        try {
            return pairRepo.revoke(pair.id, now, successorId);
        } catch (PessimisticLockException | LockTimeoutException e) {
            LOG.debugf("Lock wait on pair %s ended in %s", pair.id, e.getClass().getSimpleName());
            return false;
        }
    }
}
