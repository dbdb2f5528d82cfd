package tech.accesshub.platform.principal;

import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PrincipalAdminServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
    private static final String ADMIN_ID = "prn_0HZADMIN0001";

    @Mock
    private PrincipalRepository principalRepo;

    @InjectMocks
    private PrincipalAdminService service;

    private Principal alice;

    @BeforeEach
    void setUp() {
        service.clock = Clock.fixed(NOW, ZoneOffset.UTC);
        alice = new Principal();
        alice.id = "prn_0HZALICE0001";
        alice.email = "alice@example.com";
    }

    @Test
    @DisplayName("listPrincipals should return the repository listing")
    void listPrincipals_shouldReturnAll_whenCalled() {
        // Arrange
        when(principalRepo.listAllPrincipals()).thenReturn(List.of(alice));

        // Act & Assert
        assertThat(service.listPrincipals()).containsExactly(alice);
    }

    @Test
    @DisplayName("getPrincipal should throw NotFoundException when principal does not exist")
    void getPrincipal_shouldThrowNotFound_whenPrincipalMissing() {
        // Arrange
        when(principalRepo.findOptional("prn_missing")).thenReturn(Optional.empty());

        // Act & Assert
        assertThatThrownBy(() -> service.getPrincipal("prn_missing"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("setActive should deactivate a principal and stamp updatedAt")
    void setActive_shouldDeactivate_whenAnotherAdminActs() {
        // Arrange
        when(principalRepo.findOptional(alice.id)).thenReturn(Optional.of(alice));

        // Act
        Principal result = service.setActive(ADMIN_ID, alice.id, false);

        // Assert
        assertThat(result.active).isFalse();
        assertThat(result.updatedAt).isEqualTo(NOW);
        verify(principalRepo).update(alice);
    }

    @Test
    @DisplayName("setActive should reactivate a deactivated principal")
    void setActive_shouldReactivate_whenPrincipalInactive() {
        // Arrange
        alice.active = false;
        when(principalRepo.findOptional(alice.id)).thenReturn(Optional.of(alice));

        // Act
        Principal result = service.setActive(ADMIN_ID, alice.id, true);

        // Assert
        assertThat(result.active).isTrue();
        verify(principalRepo).update(alice);
    }

    @Test
    @DisplayName("setActive should not write when the flag is unchanged")
    void setActive_shouldSkipUpdate_whenAlreadyInState() {
        // Arrange
        when(principalRepo.findOptional(alice.id)).thenReturn(Optional.of(alice));

        // Act
        service.setActive(ADMIN_ID, alice.id, true);

        // Assert
        verify(principalRepo, never()).update(any(Principal.class));
    }

    @Test
    @DisplayName("setActive should refuse to let an administrator deactivate themselves")
    void setActive_shouldThrowBadRequest_whenDeactivatingSelf() {
        // Arrange
        alice.admin = true;
        when(principalRepo.findOptional(alice.id)).thenReturn(Optional.of(alice));

        // Act & Assert
        assertThatThrownBy(() -> service.setActive(alice.id, alice.id, false))
            .isInstanceOf(BadRequestException.class);
        assertThat(alice.active).isTrue();
        verify(principalRepo, never()).update(any(Principal.class));
    }

    @Test
    @DisplayName("setAdmin should promote a principal")
    void setAdmin_shouldPromote_whenPrincipalExists() {
        // Arrange
        when(principalRepo.findOptional(alice.id)).thenReturn(Optional.of(alice));

        // Act
        Principal result = service.setAdmin(ADMIN_ID, alice.id, true);

        // Assert
        assertThat(result.admin).isTrue();
        assertThat(result.updatedAt).isEqualTo(NOW);
        verify(principalRepo).update(alice);
    }

    @Test
    @DisplayName("setAdmin should refuse to let an administrator demote themselves")
    void setAdmin_shouldThrowBadRequest_whenDemotingSelf() {
        // Arrange
        alice.admin = true;
        when(principalRepo.findOptional(alice.id)).thenReturn(Optional.of(alice));

        // Act & Assert
        assertThatThrownBy(() -> service.setAdmin(alice.id, alice.id, false))
            .isInstanceOf(BadRequestException.class);
        assertThat(alice.admin).isTrue();
        verify(principalRepo, never()).update(any(Principal.class));
    }

    @Test
    @DisplayName("setAdmin should let another administrator demote a principal")
    void setAdmin_shouldDemote_whenAnotherAdminActs() {
        // Arrange
        alice.admin = true;
        when(principalRepo.findOptional(alice.id)).thenReturn(Optional.of(alice));

        // Act
        Principal result = service.setAdmin(ADMIN_ID, alice.id, false);

        // Assert
        assertThat(result.admin).isFalse();
        verify(principalRepo).update(alice);
    }

    @Test
    @DisplayName("setAdmin should throw NotFoundException when principal does not exist")
    void setAdmin_shouldThrowNotFound_whenPrincipalMissing() {
        // Arrange
        when(principalRepo.findOptional("prn_missing")).thenReturn(Optional.empty());

        // Act & Assert
        assertThatThrownBy(() -> service.setAdmin(ADMIN_ID, "prn_missing", true))
            .isInstanceOf(NotFoundException.class);
    }
}
