package tech.accesshub.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.accesshub.platform.access.AccessQueryService;
import tech.accesshub.platform.application.Application;
import tech.accesshub.platform.authentication.AuthConfig;
import tech.accesshub.platform.shared.EntityType;
import tech.accesshub.platform.shared.SecureTokens;
import tech.accesshub.platform.shared.TsidGenerator;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mints single-use authorization codes.
 *
 * <p>Checks run in this order and stop at the first failure:
 * <ol>
 *   <li>client_id names an active application, else {@code invalid_client}</li>
 *   <li>redirect_uri is registered for it, else {@code invalid_request}</li>
 *   <li>response_type is {@code code}, else {@code unsupported_response_type}</li>
 *   <li>the principal may access the application, else {@code access_denied}</li>
 * </ol>
 * The first two are answered directly; the last two are redirected to the client.
 */
@ApplicationScoped
public class AuthorizationCodeIssuer {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeIssuer.class);
    private static final int CODE_BYTES = 32;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    AccessQueryService accessQueryService;

    @Inject
    AuthorizationCodeRepository codeRepo;

    @Inject
    AuthConfig authConfig;

    @Inject
    Clock clock;

    /**
     * Validate the client and redirect URI of a request. Nothing is redirected before this passes.
     *
     * @return the requesting application
     */
    public Application validateClient(AuthorizationRequest request) {
        if (request.clientId() == null || request.clientId().isBlank()) {
            throw new OAuthException(OAuthError.INVALID_CLIENT, "client_id is required");
        }
        Application application = clientRegistry.findActive(request.clientId())
            .orElseThrow(() -> new OAuthException(OAuthError.INVALID_CLIENT,
                "Unknown or inactive client_id " + request.clientId()));

        if (request.redirectUri() == null || request.redirectUri().isBlank()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uri is required");
        }
        if (!clientRegistry.isRedirectUriAllowed(application, request.redirectUri())) {
            throw new OAuthException(OAuthError.INVALID_REQUEST,
                "redirect_uri " + request.redirectUri() + " not registered for client " + request.clientId());
        }
        return application;
    }

    /**
     * Issue a code for an authenticated principal.
     */
    @Transactional
    public AuthorizationCode issue(AuthorizationRequest request, String principalId) {
        Application application = validateClient(request);

        if (!"code".equals(request.responseType())) {
            throw new AuthorizationRedirectException(OAuthError.UNSUPPORTED_RESPONSE_TYPE,
                "Unsupported response_type " + request.responseType(), request.redirectUri(), request.state());
        }

        if (!accessQueryService.canAccess(principalId, application)) {
            throw new AuthorizationRedirectException(OAuthError.ACCESS_DENIED,
                "Principal " + principalId + " has no access to application " + application.id,
                request.redirectUri(), request.state());
        }

        Instant now = clock.instant();
        AuthorizationCode code = new AuthorizationCode();
        code.id = TsidGenerator.generate(EntityType.AUTH_CODE);
        code.code = SecureTokens.randomUrlSafe(CODE_BYTES);
        code.subjectId = principalId;
        code.applicationId = application.id;
        code.redirectUri = request.redirectUri();
        code.scopes = Scopes.negotiate(request.scope());
        code.clientState = request.state();
        code.issuedAt = now;
        code.expiresAt = now.plus(authConfig.jwt().authorizationCodeExpiry());
        codeRepo.persist(code);

        LOG.infof("Authorization code issued for application %s, principal %s", application.id, principalId);
        return code;
    }

    /**
     * The redirect carrying a code back to the client, with the client's state echoed verbatim.
     */
    public URI callbackUri(AuthorizationCode code) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("code", code.code);
        if (code.clientState != null) {
            params.put("state", code.clientState);
        }
        return CallbackUrl.withParameters(code.redirectUri, params);
    }
}
