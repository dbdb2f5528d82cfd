package tech.accesshub.platform.access;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.accesshub.platform.application.Application;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AccessEvaluator.
 * Walks the decision table: active flag, public flag, direct grants and group grants.
 */
class AccessEvaluatorTest {

    private static final String ALICE = "prn_ALICE";
    private static final String BOB = "prn_BOB";
    private static final String ENGINEERING = "grp_ENG";

    private final AccessEvaluator evaluator = new AccessEvaluator();

    private static Application application(String id, boolean active, boolean publicAccess) {
        Application application = new Application();
        application.id = id;
        application.active = active;
        application.publicAccess = publicAccess;
        return application;
    }

    private static AccessGrant grant(Grantee grantee, String applicationId) {
        return new AccessGrant("gnt_" + grantee.id(), grantee, applicationId, Instant.EPOCH, null);
    }

    @Test
    @DisplayName("canAccess should deny an active private application without grants")
    void canAccess_shouldDeny_whenNoGrants() {
        assertThat(evaluator.canAccess(ALICE, application("app_1", true, false), Set.of(), List.of())).isFalse();
    }

    @Test
    @DisplayName("canAccess should allow everyone on a public application")
    void canAccess_shouldAllow_whenApplicationPublic() {
        assertThat(evaluator.canAccess(ALICE, application("app_1", true, true), Set.of(), List.of())).isTrue();
    }

    @Test
    @DisplayName("canAccess should deny an inactive application even if public and granted")
    void canAccess_shouldDeny_whenApplicationInactive() {
        // Arrange
        Application inactive = application("app_1", false, true);
        List<AccessGrant> grants = List.of(grant(new Grantee.Direct(ALICE), "app_1"));

        // Act & Assert
        assertThat(evaluator.canAccess(ALICE, inactive, Set.of(), grants)).isFalse();
    }

    @Test
    @DisplayName("canAccess should allow the principal named by a direct grant, and nobody else")
    void canAccess_shouldAllowOnlyGrantee_whenDirectGrant() {
        // Arrange
        Application app = application("app_1", true, false);
        List<AccessGrant> grants = List.of(grant(new Grantee.Direct(ALICE), "app_1"));

        // Act & Assert
        assertThat(evaluator.canAccess(ALICE, app, Set.of(), grants)).isTrue();
        assertThat(evaluator.canAccess(BOB, app, Set.of(), grants)).isFalse();
    }

    @Test
    @DisplayName("canAccess should allow members of a granted group")
    void canAccess_shouldAllowMember_whenGroupGranted() {
        // Arrange
        Application app = application("app_1", true, false);
        List<AccessGrant> grants = List.of(grant(new Grantee.Group(ENGINEERING), "app_1"));

        // Act & Assert
        assertThat(evaluator.canAccess(ALICE, app, Set.of(ENGINEERING), grants)).isTrue();
        assertThat(evaluator.canAccess(BOB, app, Set.of("grp_SALES"), grants)).isFalse();
    }

    @Test
    @DisplayName("canAccess should ignore grants for other applications")
    void canAccess_shouldDeny_whenGrantTargetsOtherApplication() {
        // Arrange
        List<AccessGrant> grants = List.of(grant(new Grantee.Direct(ALICE), "app_2"));

        // Act & Assert
        assertThat(evaluator.canAccess(ALICE, application("app_1", true, false), Set.of(), grants)).isFalse();
    }

    @Test
    @DisplayName("canAccess should never lose access when grants or memberships are added")
    void canAccess_shouldStayAllowed_whenMoreGrantsAdded() {
        // Arrange
        Application app = application("app_1", true, false);
        List<AccessGrant> before = List.of(grant(new Grantee.Direct(ALICE), "app_1"));
        List<AccessGrant> after = List.of(
            grant(new Grantee.Direct(ALICE), "app_1"),
            grant(new Grantee.Group(ENGINEERING), "app_1"),
            grant(new Grantee.Direct(BOB), "app_2"));

        // Act & Assert
        assertThat(evaluator.canAccess(ALICE, app, Set.of(), before)).isTrue();
        assertThat(evaluator.canAccess(ALICE, app, Set.of(ENGINEERING, "grp_SALES"), after)).isTrue();
    }

    @Test
    @DisplayName("canAccess should deny when the application is missing")
    void canAccess_shouldDeny_whenApplicationNull() {
        assertThat(evaluator.canAccess(ALICE, null, Set.of(), List.of())).isFalse();
    }
}
