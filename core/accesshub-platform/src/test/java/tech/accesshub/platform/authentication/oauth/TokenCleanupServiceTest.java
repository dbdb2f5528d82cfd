package tech.accesshub.platform.authentication.oauth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.accesshub.platform.principal.Principal;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class TokenCleanupServiceTest {

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
    @DisplayName("purgeExpired should keep live codes and pairs")
    void purgeExpired_shouldDeleteNothing_whenAllLive() {
        // Arrange
        ctx.issueCode(alice, client);
        ctx.exchange(alice, client);

        // Act
        TokenCleanupService.CleanupResult result = ctx.cleanupService.purgeExpired();

        // Assert
        assertThat(result.codesDeleted()).isZero();
        assertThat(result.pairsDeleted()).isZero();
        assertThat(ctx.codeRepo.count()).isEqualTo(2);
        assertThat(ctx.pairRepo.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("purgeExpired should delete expired codes and pairs past refresh expiry")
    void purgeExpired_shouldDeleteExpired_whenPastExpiry() {
        // Arrange
        ctx.issueCode(alice, client);
        ctx.exchange(alice, client);
        ctx.clock.advance(Duration.ofDays(8));

        // Act
        TokenCleanupService.CleanupResult result = ctx.cleanupService.purgeExpired();

        // Assert
        assertThat(result.codesDeleted()).isEqualTo(2);
        assertThat(result.pairsDeleted()).isEqualTo(1);
        assertThat(ctx.codeRepo.count()).isZero();
        assertThat(ctx.pairRepo.count()).isZero();
    }
}
