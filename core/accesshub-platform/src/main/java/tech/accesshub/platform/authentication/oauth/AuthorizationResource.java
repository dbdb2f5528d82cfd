package tech.accesshub.platform.authentication.oauth;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.accesshub.platform.authentication.AuthConfig;
import tech.accesshub.platform.authentication.JwtKeyService;
import tech.accesshub.platform.principal.Principal;
import tech.accesshub.platform.principal.PrincipalRepository;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OAuth2 endpoints of the hub:
 * - Authorization endpoint (authorization code flow)
 * - Token endpoint (authorization_code and refresh_token grants)
 * - UserInfo endpoint
 * - Revocation endpoint (RFC 7009)
 *
 * Rejections are thrown as {@link OAuthException} and rendered by {@link OAuthExceptionMapper}.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749">RFC 6749 - OAuth 2.0</a>
 */
@Path("/oauth")
@Tag(name = "OAuth2 Authorization", description = "OAuth2 authorization code flow endpoints")
public class AuthorizationResource {

    private static final Logger LOG = Logger.getLogger(AuthorizationResource.class);
    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    AuthConfig authConfig;

    @Inject
    JwtKeyService jwtKeyService;

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    AuthorizationCodeIssuer codeIssuer;

    @Inject
    CodeExchanger codeExchanger;

    @Inject
    TokenRefresher tokenRefresher;

    @Inject
    TokenResolver tokenResolver;

    @Inject
    TokenRevoker tokenRevoker;

    @Context
    UriInfo uriInfo;

    @Context
    HttpHeaders httpHeaders;

    // ==================== Authorization Endpoint ====================

    /**
     * OAuth2 Authorization endpoint.
     *
     * GET /oauth/authorize?
     *   response_type=code
     *   &client_id=hub_x3Kf...
     *   &redirect_uri=https://app.example.com/callback
     *   &scope=openid profile
     *   &state=xyz123
     *
     * Without a valid session the user is sent to the login URL and returns here afterwards.
     */
    @GET
    @Path("/authorize")
    @Operation(summary = "Start authorization code flow")
    public Response authorize(
            @Parameter(description = "Must be 'code'")
            @QueryParam("response_type") String responseType,

            @Parameter(description = "OAuth client ID")
            @QueryParam("client_id") String clientId,

            @Parameter(description = "URI to redirect after authorization")
            @QueryParam("redirect_uri") String redirectUri,

            @Parameter(description = "Requested scopes (space-separated)")
            @QueryParam("scope") String scope,

            @Parameter(description = "Client state for CSRF protection")
            @QueryParam("state") String state
    ) {
        AuthorizationRequest request = new AuthorizationRequest(responseType, clientId, redirectUri, scope, state);

        // Client and redirect_uri are checked before anything can redirect
        codeIssuer.validateClient(request);

        Optional<String> principalId = sessionPrincipalId();
        if (principalId.isEmpty()) {
            return redirectToLogin();
        }

        AuthorizationCode code = codeIssuer.issue(request, principalId.get());
        return Response.seeOther(codeIssuer.callbackUri(code)).build();
    }

    // ==================== Token Endpoint ====================

    /**
     * OAuth2 Token endpoint.
     *
     * Supports grant types:
     * - authorization_code: Exchange code for access + refresh tokens
     * - refresh_token: Rotate a refresh token into a new pair
     *
     * Client authentication: client_secret_basic or client_secret_post.
     */
    @POST
    @Path("/token")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Exchange code for tokens or refresh tokens")
    public Response token(
            @HeaderParam("Authorization") String authHeader,

            @Parameter(description = "Grant type")
            @FormParam("grant_type") String grantType,

            @Parameter(description = "Authorization code (for authorization_code grant)")
            @FormParam("code") String code,

            @Parameter(description = "Redirect URI (must match authorization request)")
            @FormParam("redirect_uri") String redirectUri,

            @Parameter(description = "Refresh token (for refresh_token grant)")
            @FormParam("refresh_token") String refreshToken,

            @Parameter(description = "Client ID")
            @FormParam("client_id") String formClientId,

            @Parameter(description = "Client secret")
            @FormParam("client_secret") String formClientSecret
    ) {
        if (grantType == null || grantType.isBlank()) {
            throw new OAuthException(OAuthError.INVALID_REQUEST, "grant_type is required");
        }

        ClientCredentials credentials = ClientCredentials.resolve(authHeader, formClientId, formClientSecret);

        IssuedTokens tokens = switch (grantType) {
            case "authorization_code" -> codeExchanger.exchange(code, redirectUri, credentials);
            case "refresh_token" -> tokenRefresher.refresh(refreshToken, credentials);
            default -> throw new OAuthException(OAuthError.UNSUPPORTED_GRANT_TYPE, "Grant type not supported: " + grantType);
        };

        return Response.ok(TokenResponse.from(tokens))
            .header("Cache-Control", "no-store")
            .header("Pragma", "no-cache")
            .build();
    }

    // ==================== UserInfo Endpoint ====================

    @GET
    @Path("/userinfo")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Claims about the user an access token was issued to")
    public Response userinfo(@HeaderParam("Authorization") String authHeader) {
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)
                || authHeader.substring(BEARER_PREFIX.length()).isBlank()) {
            throw OAuthException.unauthorizedBearer(OAuthError.INVALID_REQUEST, "Bearer token missing");
        }

        Principal principal = tokenResolver.resolveSubject(authHeader.substring(BEARER_PREFIX.length()).trim());

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", principal.id);
        claims.put("email", principal.email);
        claims.put("name", principal.displayName != null ? principal.displayName : principal.email);
        claims.put("preferred_username", principal.email);
        claims.put("groups", principal.idpGroups != null ? principal.idpGroups : List.of());

        return Response.ok(claims)
            .header("Cache-Control", "no-store")
            .build();
    }

    // ==================== Revocation Endpoint ====================

    /**
     * Token revocation. Answers 200 once the client authenticates, whatever happened to the token.
     */
    @POST
    @Path("/revoke")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Revoke an access or refresh token")
    public Response revoke(
            @HeaderParam("Authorization") String authHeader,

            @Parameter(description = "The token to revoke")
            @FormParam("token") String token,

            @Parameter(description = "access_token or refresh_token")
            @FormParam("token_type_hint") String tokenTypeHint,

            @FormParam("client_id") String formClientId,

            @FormParam("client_secret") String formClientSecret
    ) {
        ClientCredentials credentials = ClientCredentials.resolve(authHeader, formClientId, formClientSecret);
        tokenRevoker.revoke(token, TokenTypeHint.parse(tokenTypeHint), credentials);
        return Response.ok().build();
    }

    // ==================== Helper Methods ====================

    private Optional<String> sessionPrincipalId() {
        Cookie cookie = httpHeaders.getCookies().get(authConfig.session().cookieName());
        if (cookie == null) {
            return Optional.empty();
        }
        return jwtKeyService.validateSessionToken(cookie.getValue())
            .flatMap(principalRepo::findOptional)
            .filter(principal -> principal.active)
            .map(principal -> principal.id);
    }

    private Response redirectToLogin() {
        URI requestUri = uriInfo.getRequestUri();
        String returnTo = requestUri.getRawQuery() != null
            ? requestUri.getRawPath() + "?" + requestUri.getRawQuery()
            : requestUri.getRawPath();

        String loginUrl = authConfig.loginUrl();
        String location = loginUrl + (loginUrl.contains("?") ? "&" : "?")
            + "redirect_to=" + CallbackUrl.urlEncode(returnTo);

        LOG.debugf("Authorization request without session, redirecting to %s", loginUrl);
        return Response.seeOther(URI.create(location)).build();
    }

    // ==================== DTOs ====================

    public record TokenResponse(
        String access_token,
        String token_type,
        long expires_in,
        String refresh_token,
        String scope
    ) {
        static TokenResponse from(IssuedTokens tokens) {
            return new TokenResponse(
                tokens.accessToken(),
                "Bearer",
                tokens.expiresIn(),
                tokens.refreshToken(),
                tokens.scope());
        }
    }
}
