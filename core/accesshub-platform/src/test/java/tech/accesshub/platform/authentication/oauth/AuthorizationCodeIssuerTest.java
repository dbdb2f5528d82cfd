package tech.accesshub.platform.authentication.oauth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.accesshub.platform.principal.Principal;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AuthorizationCodeIssuer.
 * Covers the validation order, redirect errors and the properties of issued codes.
 */
class AuthorizationCodeIssuerTest {

    private OAuthTestContext ctx;
    private OAuthTestContext.Client client;
    private Principal alice;

    @BeforeEach
    void setUp() {
        ctx = new OAuthTestContext();
        client = ctx.registerClient("expenses");
        alice = ctx.createPrincipal("alice@example.com");
    }

    @Test
    @DisplayName("issue should bind code to subject, client, redirect URI and state")
    void issue_shouldBindCode_whenPrincipalHasAccess() {
        // Arrange
        ctx.grantDirect(alice, client);

        // Act
        AuthorizationCode code = ctx.codeIssuer.issue(
            ctx.authorizationRequest(client, "openid email", "state-123"), alice.id);

        // Assert
        assertThat(code.code).isNotBlank();
        assertThat(code.subjectId).isEqualTo(alice.id);
        assertThat(code.applicationId).isEqualTo(client.application().id);
        assertThat(code.redirectUri).isEqualTo(OAuthTestContext.REDIRECT_URI);
        assertThat(code.clientState).isEqualTo("state-123");
        assertThat(code.scopes).containsExactly("openid", "email");
        assertThat(code.consumedAt).isNull();
        assertThat(Duration.between(code.issuedAt, code.expiresAt)).isEqualTo(Duration.ofMinutes(10));
        assertThat(ctx.codeRepo.findByCode(code.code)).isPresent();
    }

    @Test
    @DisplayName("issue should produce a different code value every time")
    void issue_shouldProduceDistinctCodes_whenCalledRepeatedly() {
        // Arrange
        ctx.grantDirect(alice, client);

        // Act
        AuthorizationCode first = ctx.issueCode(alice, client);
        AuthorizationCode second = ctx.issueCode(alice, client);

        // Assert
        assertThat(first.code).isNotEqualTo(second.code);
        assertThat(first.id).startsWith("acd_").isNotEqualTo(second.id);
    }

    @Test
    @DisplayName("issue should redirect access_denied when principal has no grant")
    void issue_shouldRedirectAccessDenied_whenPrincipalHasNoAccess() {
        // Act & Assert
        assertThatThrownBy(() -> ctx.codeIssuer.issue(ctx.authorizationRequest(client, "openid", "s1"), alice.id))
            .isInstanceOfSatisfying(AuthorizationRedirectException.class, e -> {
                assertThat(e.getError()).isEqualTo(OAuthError.ACCESS_DENIED);
                assertThat(e.location().toString())
                    .isEqualTo("https://app.example.com/callback?error=access_denied&state=s1");
            });
        assertThat(ctx.codeRepo.count()).isZero();
    }

    @Test
    @DisplayName("issue should redirect unsupported_response_type for response_type token")
    void issue_shouldRedirectUnsupportedResponseType_whenResponseTypeIsNotCode() {
        // Arrange
        ctx.grantDirect(alice, client);
        AuthorizationRequest request = new AuthorizationRequest(
            "token", client.application().clientId, OAuthTestContext.REDIRECT_URI, "openid", null);

        // Act & Assert
        assertThatThrownBy(() -> ctx.codeIssuer.issue(request, alice.id))
            .isInstanceOfSatisfying(AuthorizationRedirectException.class, e ->
                assertThat(e.location().toString())
                    .isEqualTo("https://app.example.com/callback?error=unsupported_response_type"));
    }

    @Test
    @DisplayName("validateClient should reject unknown client_id without redirecting")
    void validateClient_shouldRejectInvalidClient_whenClientIdUnknown() {
        // Arrange
        AuthorizationRequest request = new AuthorizationRequest(
            "code", "hub_unknown", OAuthTestContext.REDIRECT_URI, "openid", "s");

        // Act & Assert
        assertThatThrownBy(() -> ctx.codeIssuer.validateClient(request))
            .isExactlyInstanceOf(OAuthException.class)
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_CLIENT);
    }

    @Test
    @DisplayName("validateClient should reject inactive application as invalid_client")
    void validateClient_shouldRejectInvalidClient_whenApplicationInactive() {
        // Arrange
        client.application().active = false;

        // Act & Assert
        assertThatThrownBy(() -> ctx.codeIssuer.validateClient(ctx.authorizationRequest(client, "openid", null)))
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_CLIENT);
    }

    @Test
    @DisplayName("validateClient should reject unregistered redirect URI without redirecting")
    void validateClient_shouldRejectInvalidRequest_whenRedirectUriNotRegistered() {
        // Arrange
        AuthorizationRequest request = new AuthorizationRequest(
            "code", client.application().clientId, "https://app.example.com/callback/other", "openid", "s");

        // Act & Assert
        assertThatThrownBy(() -> ctx.codeIssuer.validateClient(request))
            .isExactlyInstanceOf(OAuthException.class)
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("callbackUri should carry code and echo state verbatim")
    void callbackUri_shouldCarryCodeAndState_whenStatePresent() {
        // Arrange
        ctx.grantDirect(alice, client);
        AuthorizationCode code = ctx.codeIssuer.issue(
            ctx.authorizationRequest(client, "openid", "a b&c"), alice.id);

        // Act
        String callback = ctx.codeIssuer.callbackUri(code).toString();

        // Assert
        assertThat(callback).isEqualTo(OAuthTestContext.REDIRECT_URI
            + "?code=" + CallbackUrl.urlEncode(code.code) + "&state=a+b%26c");
    }
}
