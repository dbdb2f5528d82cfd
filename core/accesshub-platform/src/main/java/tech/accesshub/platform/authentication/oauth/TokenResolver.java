package tech.accesshub.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accesshub.platform.application.ApplicationRepository;
import tech.accesshub.platform.authentication.AccessTokenClaims;
import tech.accesshub.platform.authentication.JwtKeyService;
import tech.accesshub.platform.principal.Principal;
import tech.accesshub.platform.principal.PrincipalRepository;

import java.time.Clock;
import java.time.Instant;

/**
 * Validates bearer access tokens against their signature, their backing token pair and the
 * application they were issued to.
 */
@ApplicationScoped
public class TokenResolver {

    private static final Logger LOG = Logger.getLogger(TokenResolver.class);

    @Inject
    JwtKeyService jwtKeyService;

    @Inject
    TokenPairRepository pairRepo;

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    ApplicationRepository applicationRepo;

    @Inject
    Clock clock;

    /**
     * Resolve an access token to its live token pair.
     *
     * @throws OAuthException 401 {@code invalid_grant} when the signature, issuer or expiry is bad,
     *                        the pair is missing, revoked or expired, or its application is
     *                        missing or deactivated
     */
    public TokenPair resolve(String accessToken) {
        AccessTokenClaims claims = jwtKeyService.verifyAccessToken(accessToken)
            .orElseThrow(() -> rejected("Access token failed verification"));

        TokenPair pair = pairRepo.findOptional(claims.tokenId())
            .orElseThrow(() -> rejected("No token pair for jti " + claims.tokenId()));

        Instant now = clock.instant();
        if (pair.isRevoked()) {
            throw rejected("Token pair " + pair.id + " revoked");
        }
        if (pair.isAccessExpired(now)) {
            throw rejected("Token pair " + pair.id + " expired");
        }
        if (!pair.subjectId.equals(claims.subjectId())) {
            throw rejected("Subject mismatch for token pair " + pair.id);
        }
        boolean applicationActive = applicationRepo.findOptional(pair.applicationId)
            .map(application -> application.active)
            .orElse(false);
        if (!applicationActive) {
            throw rejected("Application " + pair.applicationId + " of token pair " + pair.id + " missing or inactive");
        }
        LOG.debugf("Access token resolved to pair %s", pair.id);
        return pair;
    }

    /**
     * Resolve an access token to the active principal it was issued to.
     */
    public Principal resolveSubject(String accessToken) {
        TokenPair pair = resolve(accessToken);
        return principalRepo.findOptional(pair.subjectId)
            .filter(principal -> principal.active)
            .orElseThrow(() -> rejected("Principal " + pair.subjectId + " missing or inactive"));
    }

    private static OAuthException rejected(String reason) {
        return OAuthException.unauthorizedBearer(OAuthError.INVALID_GRANT, reason);
    }
}
