package tech.accesshub.platform.authentication.oauth.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for the token_pairs table.
 */
@Entity
@Table(name = "token_pairs", indexes = {
    @Index(name = "idx_token_pairs_lineage", columnList = "lineage_id"),
    @Index(name = "idx_token_pairs_refresh_expires_at", columnList = "refresh_expires_at")
})
public class TokenPairEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "refresh_token_hash", nullable = false, unique = true, length = 64)
    public String refreshTokenHash;

    @Column(name = "lineage_id", nullable = false, length = 17)
    public String lineageId;

    @Column(name = "subject_id", nullable = false, length = 17)
    public String subjectId;

    @Column(name = "application_id", nullable = false, length = 17)
    public String applicationId;

    /**
     * Space-separated granted scopes.
     */
    @Column(name = "scope", nullable = false, length = 1000)
    public String scope;

    @Column(name = "issued_at", nullable = false)
    public Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "refresh_expires_at", nullable = false)
    public Instant refreshExpiresAt;

    @Column(name = "revoked_at")
    public Instant revokedAt;

    @Column(name = "replaced_by", length = 17)
    public String replacedBy;

    public TokenPairEntity() {
    }
}
