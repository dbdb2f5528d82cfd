package tech.accesshub.platform.authentication.oauth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.accesshub.platform.principal.Principal;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TokenRevoker.
 */
class TokenRevokerTest {

    private OAuthTestContext ctx;
    private OAuthTestContext.Client client;
    private Principal alice;

    @BeforeEach
    void setUp() {
        ctx = new OAuthTestContext();
        client = ctx.registerClient("expenses");
        alice = ctx.createPrincipal("alice@example.com");
        ctx.grantDirect(alice, client);
    }

    @Test
    @DisplayName("revoke should revoke the pair of a refresh token")
    void revoke_shouldRevokePair_whenRefreshTokenPresented() {
        // Arrange
        IssuedTokens tokens = ctx.exchange(alice, client);

        // Act
        boolean revoked = ctx.tokenRevoker.revoke(tokens.refreshToken(), TokenTypeHint.REFRESH_TOKEN, client.credentials());

        // Assert
        assertThat(revoked).isTrue();
        assertThat(ctx.pairRepo.findOptional(tokens.pairId()).orElseThrow().isRevoked()).isTrue();
    }

    @Test
    @DisplayName("revoke should find an access token even when hinted as refresh token")
    void revoke_shouldRevokePair_whenAccessTokenPresentedWithWrongHint() {
        // Arrange
        IssuedTokens tokens = ctx.exchange(alice, client);

        // Act
        boolean revoked = ctx.tokenRevoker.revoke(tokens.accessToken(), TokenTypeHint.REFRESH_TOKEN, client.credentials());

        // Assert
        assertThat(revoked).isTrue();
        assertThatThrownBy(() -> ctx.tokenResolver.resolve(tokens.accessToken())).isInstanceOf(OAuthException.class);
    }

    @Test
    @DisplayName("revoke should quietly ignore unknown tokens")
    void revoke_shouldReturnFalse_whenTokenUnknown() {
        // Act
        boolean revoked = ctx.tokenRevoker.revoke("nope", TokenTypeHint.ACCESS_TOKEN, client.credentials());

        // Assert
        assertThat(revoked).isFalse();
    }

    @Test
    @DisplayName("SECURITY: revoke should not let one client revoke another client's tokens")
    void revoke_shouldLeavePairAlone_whenTokenBelongsToOtherClient() {
        // Arrange
        IssuedTokens tokens = ctx.exchange(alice, client);
        OAuthTestContext.Client other = ctx.registerClient("payroll");

        // Act
        boolean revoked = ctx.tokenRevoker.revoke(tokens.refreshToken(), TokenTypeHint.REFRESH_TOKEN, other.credentials());

        // Assert
        assertThat(revoked).isFalse();
        assertThat(ctx.pairRepo.findOptional(tokens.pairId()).orElseThrow().isRevoked()).isFalse();
    }

    @Test
    @DisplayName("revoke should require client authentication before anything else")
    void revoke_shouldRejectInvalidClient_whenCredentialsMissing() {
        // Act & Assert
        assertThatThrownBy(() -> ctx.tokenRevoker.revoke("anything", TokenTypeHint.REFRESH_TOKEN,
                new ClientCredentials(null, null, false)))
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_CLIENT);
    }

    @Test
    @DisplayName("revoke should report nothing revoked the second time")
    void revoke_shouldReturnFalse_whenAlreadyRevoked() {
        // Arrange
        IssuedTokens tokens = ctx.exchange(alice, client);
        ctx.tokenRevoker.revoke(tokens.refreshToken(), TokenTypeHint.REFRESH_TOKEN, client.credentials());

        // Act
        boolean revoked = ctx.tokenRevoker.revoke(tokens.refreshToken(), TokenTypeHint.REFRESH_TOKEN, client.credentials());

        // Assert
        assertThat(revoked).isFalse();
    }
}
