package tech.accesshub.platform.access.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import tech.accesshub.platform.access.GranteeType;

import java.time.Instant;

/**
 * JPA entity for the access_grants table.
 */
@Entity
@Table(name = "access_grants",
    uniqueConstraints = @UniqueConstraint(columnNames = {"grantee_type", "grantee_id", "application_id"}))
public class AccessGrantEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "grantee_type", nullable = false, length = 10)
    public GranteeType granteeType;

    @Column(name = "grantee_id", nullable = false, length = 17)
    public String granteeId;

    @Column(name = "application_id", nullable = false, length = 17)
    public String applicationId;

    @Column(name = "granted_at", nullable = false)
    public Instant grantedAt;

    @Column(name = "granted_by", length = 17)
    public String grantedBy;

    public AccessGrantEntity() {
    }
}
