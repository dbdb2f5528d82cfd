package tech.accesshub.platform.authentication.oauth;

import jakarta.persistence.PessimisticLockException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.accesshub.platform.authentication.AccessTokenClaims;
import tech.accesshub.platform.principal.Principal;
import tech.accesshub.platform.test.InMemoryAuthorizationCodeRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CodeExchanger.
 * SECURITY: codes are single use, bound to their redirect URI and client, and short-lived.
 */
class CodeExchangerTest {

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
    @DisplayName("exchange should issue a token pair and consume the code")
    void exchange_shouldIssueTokens_whenCodeValid() {
        // Arrange
        AuthorizationCode code = ctx.issueCode(alice, client);

        // Act
        IssuedTokens tokens = ctx.codeExchanger.exchange(code.code, OAuthTestContext.REDIRECT_URI, client.credentials());

        // Assert
        assertThat(tokens.accessToken()).isNotBlank();
        assertThat(tokens.refreshToken()).isNotBlank();
        assertThat(tokens.expiresIn()).isEqualTo(3600);
        assertThat(tokens.scope()).isEqualTo("openid profile");
        assertThat(ctx.codeRepo.findByCode(code.code).orElseThrow().consumedAt).isNotNull();

        AccessTokenClaims claims = ctx.jwtKeyService.verifyAccessToken(tokens.accessToken()).orElseThrow();
        assertThat(claims.subjectId()).isEqualTo(alice.id);
        assertThat(claims.clientId()).isEqualTo(client.application().clientId);
        assertThat(claims.tokenId()).isEqualTo(tokens.pairId());
    }

    @Test
    @DisplayName("SECURITY: exchange should reject the second redemption of a code")
    void exchange_shouldRejectReplay_whenCodeAlreadyConsumed() {
        // Arrange
        AuthorizationCode code = ctx.issueCode(alice, client);
        ctx.codeExchanger.exchange(code.code, OAuthTestContext.REDIRECT_URI, client.credentials());

        // Act & Assert
        assertThatThrownBy(() ->
            ctx.codeExchanger.exchange(code.code, OAuthTestContext.REDIRECT_URI, client.credentials()))
            .isInstanceOf(CodeReplayException.class)
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_GRANT);
        assertThat(ctx.pairRepo.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("SECURITY: exactly one of many concurrent redemptions should succeed")
    void exchange_shouldSucceedExactlyOnce_whenRedeemedConcurrently() throws Exception {
        // Arrange
        AuthorizationCode code = ctx.issueCode(alice, client);
        int attempts = 16;
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<IssuedTokens>> futures = new ArrayList<>();

        // Act
        try {
            for (int i = 0; i < attempts; i++) {
                Callable<IssuedTokens> redeem = () -> {
                    start.await();
                    return ctx.codeExchanger.exchange(code.code, OAuthTestContext.REDIRECT_URI, client.credentials());
                };
                futures.add(executor.submit(redeem));
            }
            start.countDown();

            int successes = 0;
            int replays = 0;
            for (Future<IssuedTokens> future : futures) {
                try {
                    future.get(10, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(CodeReplayException.class);
                    replays++;
                }
            }

            // Assert
            assertThat(successes).isEqualTo(1);
            assertThat(replays).isEqualTo(attempts - 1);
            assertThat(ctx.pairRepo.count()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("SECURITY: exchange should answer invalid_grant when the lock wait on the code times out")
    void exchange_shouldRejectAsReplay_whenLockWaitTimesOut() {
        // Arrange
        InMemoryAuthorizationCodeRepository lockedRepo = new InMemoryAuthorizationCodeRepository() {
            @Override
            public synchronized boolean markConsumed(String code, Instant consumedAt) {
                throw new PessimisticLockException("Timeout trying to lock table AUTHORIZATION_CODES");
            }
        };
        ctx.codeIssuer.codeRepo = lockedRepo;
        ctx.codeExchanger.codeRepo = lockedRepo;
        AuthorizationCode code = ctx.issueCode(alice, client);

        // Act & Assert
        assertThatThrownBy(() ->
            ctx.codeExchanger.exchange(code.code, OAuthTestContext.REDIRECT_URI, client.credentials()))
            .isInstanceOf(CodeReplayException.class)
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_GRANT);
        assertThat(ctx.pairRepo.count()).isZero();
    }

    @Test
    @DisplayName("SECURITY: exchange should reject a redirect URI differing from the one authorized")
    void exchange_shouldRejectInvalidGrant_whenRedirectUriDiffers() {
        // Arrange
        AuthorizationCode code = ctx.issueCode(alice, client);

        // Act & Assert
        assertThatThrownBy(() ->
            ctx.codeExchanger.exchange(code.code, OAuthTestContext.REDIRECT_URI + "/", client.credentials()))
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_GRANT);
        assertThat(ctx.codeRepo.findByCode(code.code).orElseThrow().consumedAt).isNull();
    }

    @Test
    @DisplayName("exchange should reject a code at its expiry instant")
    void exchange_shouldRejectInvalidGrant_whenCodeExpired() {
        // Arrange
        AuthorizationCode code = ctx.issueCode(alice, client);
        ctx.clock.advance(Duration.ofMinutes(10));

        // Act & Assert
        assertThatThrownBy(() ->
            ctx.codeExchanger.exchange(code.code, OAuthTestContext.REDIRECT_URI, client.credentials()))
            .isExactlyInstanceOf(OAuthException.class)
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("exchange should accept a code just before expiry")
    void exchange_shouldIssueTokens_whenCodeNearlyExpired() {
        // Arrange
        AuthorizationCode code = ctx.issueCode(alice, client);
        ctx.clock.advance(Duration.ofMinutes(10).minusSeconds(1));

        // Act
        IssuedTokens tokens = ctx.codeExchanger.exchange(code.code, OAuthTestContext.REDIRECT_URI, client.credentials());

        // Assert
        assertThat(tokens.accessToken()).isNotBlank();
    }

    @Test
    @DisplayName("SECURITY: exchange should reject a code presented by another client")
    void exchange_shouldRejectInvalidGrant_whenCodeIssuedToOtherClient() {
        // Arrange
        AuthorizationCode code = ctx.issueCode(alice, client);
        OAuthTestContext.Client other = ctx.registerClient("payroll");

        // Act & Assert
        assertThatThrownBy(() ->
            ctx.codeExchanger.exchange(code.code, OAuthTestContext.REDIRECT_URI, other.credentials()))
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("exchange should reject wrong client secret as invalid_client")
    void exchange_shouldRejectInvalidClient_whenSecretWrong() {
        // Arrange
        AuthorizationCode code = ctx.issueCode(alice, client);
        ClientCredentials wrong = new ClientCredentials(client.application().clientId, "wrong", false);

        // Act & Assert
        assertThatThrownBy(() -> ctx.codeExchanger.exchange(code.code, OAuthTestContext.REDIRECT_URI, wrong))
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_CLIENT);
        assertThat(ctx.codeRepo.findByCode(code.code).orElseThrow().consumedAt).isNull();
    }

    @Test
    @DisplayName("exchange should reject unknown codes as invalid_grant")
    void exchange_shouldRejectInvalidGrant_whenCodeUnknown() {
        // Act & Assert
        assertThatThrownBy(() ->
            ctx.codeExchanger.exchange("not-a-code", OAuthTestContext.REDIRECT_URI, client.credentials()))
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_GRANT);
    }

    @Test
    @DisplayName("exchange should reject a missing code as invalid_request")
    void exchange_shouldRejectInvalidRequest_whenCodeMissing() {
        // Act & Assert
        assertThatThrownBy(() -> ctx.codeExchanger.exchange(" ", OAuthTestContext.REDIRECT_URI, client.credentials()))
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("exchange should reject codes of a deactivated principal")
    void exchange_shouldRejectInvalidGrant_whenPrincipalDeactivated() {
        // Arrange
        AuthorizationCode code = ctx.issueCode(alice, client);
        alice.active = false;

        // Act & Assert
        assertThatThrownBy(() ->
            ctx.codeExchanger.exchange(code.code, OAuthTestContext.REDIRECT_URI, client.credentials()))
            .extracting(e -> ((OAuthException) e).getError())
            .isEqualTo(OAuthError.INVALID_GRANT);
    }
}
