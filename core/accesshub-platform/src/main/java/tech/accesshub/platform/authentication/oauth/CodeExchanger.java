package tech.accesshub.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.PessimisticLockException;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.accesshub.platform.application.Application;
import tech.accesshub.platform.principal.PrincipalRepository;

import java.time.Clock;
import java.time.Instant;

/**
 * Redeems authorization codes for token pairs.
 *
 * <p>Consumption is a single conditional write: of any number of concurrent redemptions of one
 * code, exactly one sees its write take effect. A redemption that times out waiting for the
 * winner's row lock has lost the race as well. Consumption and issuance commit together.
 */
@ApplicationScoped
public class CodeExchanger {

    private static final Logger LOG = Logger.getLogger(CodeExchanger.class);

    @Inject
    AuthorizationCodeRepository codeRepo;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    TokenIssuer tokenIssuer;

    @Inject
    Clock clock;

    @Transactional
    public IssuedTokens exchange(String code, String redirectUri, ClientCredentials credentials) {
        Application application = clientRegistry.authenticate(credentials);
        if (code == null || code.isBlank()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "code is required");
        }

        AuthorizationCode authCode = codeRepo.findByCode(code)
            .orElseThrow(() -> new OAuthException(OAuthError.INVALID_GRANT, "Unknown authorization code"));

        Instant now = clock.instant();
        switch (authCode.stateAt(now)) {
            case CONSUMED -> throw new CodeReplayException("Authorization code " + authCode.id + " already consumed");
            case EXPIRED -> throw new OAuthException(OAuthError.INVALID_GRANT, "Authorization code " + authCode.id + " expired");
            case PENDING -> { }
        }

        if (redirectUri == null || !authCode.redirectUri.equals(redirectUri)) {
            throw new OAuthException(OAuthError.INVALID_GRANT, "redirect_uri mismatch for code " + authCode.id);
        }

        if (!application.id.equals(authCode.applicationId)) {
            throw new OAuthException(OAuthError.INVALID_GRANT,
                "Code " + authCode.id + " was not issued to client " + application.clientId);
        }

        boolean subjectActive = principalRepo.findOptional(authCode.subjectId)
            .map(principal -> principal.active)
            .orElse(false);
        if (!subjectActive) {
            throw new OAuthException(OAuthError.INVALID_GRANT, "Principal " + authCode.subjectId + " missing or inactive");
        }

        if (!consume(authCode, now)) {
            throw new CodeReplayException("Lost consumption race for code " + authCode.id);
        }

        LOG.infof("Authorization code %s consumed by application %s", authCode.id, application.id);
        return tokenIssuer.issue(authCode.subjectId, application, authCode.scopes);
    }

    private boolean consume(AuthorizationCode authCode, Instant now) {
        try {
            return codeRepo.markConsumed(authCode.code, now);
        } catch (PessimisticLockException | LockTimeoutException e) {
            LOG.debugf("Lock wait on code %s ended in %s", authCode.id, e.getClass().getSimpleName());
            return false;
        }
    }
}
