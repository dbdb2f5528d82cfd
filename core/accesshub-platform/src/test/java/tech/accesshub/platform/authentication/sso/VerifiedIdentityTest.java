package tech.accesshub.platform.authentication.sso;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for VerifiedIdentity claim parsing.
 */
class VerifiedIdentityTest {

    @Test
    @DisplayName("fromClaims should read the standard claims and ignore unknown ones")
    void fromClaims_shouldReadStandardClaims_whenAllPresent() {
        // Arrange
        Map<String, Object> claims = Map.of(
            "sub", "upstream-123",
            "email", "Alice@Example.com",
            "name", "Alice Smith",
            "given_name", "Alice",
            "family_name", "Smith",
            "department", "Finance",
            "jobTitle", "Controller",
            "groups", List.of("finance", "staff"),
            "nonce", "ignored");

        // Act
        VerifiedIdentity identity = VerifiedIdentity.fromClaims(claims);

        // Assert
        assertThat(identity.externalSubjectId()).isEqualTo("upstream-123");
        assertThat(identity.email()).isEqualTo("alice@example.com");
        assertThat(identity.displayName()).isEqualTo("Alice Smith");
        assertThat(identity.firstName()).isEqualTo("Alice");
        assertThat(identity.lastName()).isEqualTo("Smith");
        assertThat(identity.department()).isEqualTo("Finance");
        assertThat(identity.jobTitle()).isEqualTo("Controller");
        assertThat(identity.groupNames()).containsExactly("finance", "staff");
    }

    @Test
    @DisplayName("fromClaims should fall back to alternative claim names")
    void fromClaims_shouldUseAliases_whenStandardNamesMissing() {
        // Arrange
        Map<String, Object> claims = Map.of(
            "oid", "object-id-1",
            "upn", "bob@example.com",
            "given_name", "Bob",
            "title", "Engineer");

        // Act
        VerifiedIdentity identity = VerifiedIdentity.fromClaims(claims);

        // Assert
        assertThat(identity.externalSubjectId()).isEqualTo("object-id-1");
        assertThat(identity.email()).isEqualTo("bob@example.com");
        assertThat(identity.displayName()).isEqualTo("Bob");
        assertThat(identity.jobTitle()).isEqualTo("Engineer");
        assertThat(identity.groupNames()).isEmpty();
    }

    @Test
    @DisplayName("fromClaims should fail when a required claim is missing")
    void fromClaims_shouldThrowUpstreamError_whenEmailMissing() {
        // Arrange
        Map<String, Object> claims = Map.of("sub", "upstream-123", "name", "No Mail");

        // Act & Assert
        assertThatThrownBy(() -> VerifiedIdentity.fromClaims(claims))
            .isInstanceOf(UpstreamIdentityException.class)
            .hasMessageContaining("EMAIL");
    }

    @Test
    @DisplayName("fromClaims should treat a blank required claim as missing")
    void fromClaims_shouldThrowUpstreamError_whenSubjectBlank() {
        // Arrange
        Map<String, Object> claims = new HashMap<>();
        claims.put("sub", "  ");
        claims.put("email", "alice@example.com");

        // Act & Assert
        assertThatThrownBy(() -> VerifiedIdentity.fromClaims(claims))
            .isInstanceOf(UpstreamIdentityException.class)
            .hasMessageContaining("SUBJECT");
    }

    @Test
    @DisplayName("fromClaims should accept a single group given as a string")
    void fromClaims_shouldWrapSingleGroup_whenGroupsIsString() {
        // Arrange
        Map<String, Object> claims = Map.of("sub", "s", "email", "e@example.com", "groups", "admins");

        // Act & Assert
        assertThat(VerifiedIdentity.fromClaims(claims).groupNames()).containsExactly("admins");
    }
}
