package tech.accesshub.platform.authentication.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for the authorization_codes table.
 */
@Entity
@Table(name = "authorization_codes", indexes = @Index(name = "idx_authorization_codes_expires_at", columnList = "expires_at"))
public class AuthorizationCodeEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "code", nullable = false, unique = true, length = 64)
    public String code;

    @Column(name = "subject_id", nullable = false, length = 17)
    public String subjectId;

    @Column(name = "application_id", nullable = false, length = 17)
    public String applicationId;

    @Column(name = "redirect_uri", nullable = false, length = 2000)
    public String redirectUri;

    /**
     * Space-separated granted scopes.
     */
    @Column(name = "scope", nullable = false, length = 1000)
    public String scope;

    @Column(name = "client_state", length = 1000)
    public String clientState;

    @Column(name = "issued_at", nullable = false)
    public Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "consumed_at")
    public Instant consumedAt;

    public AuthorizationCodeEntity() {
    }
}
