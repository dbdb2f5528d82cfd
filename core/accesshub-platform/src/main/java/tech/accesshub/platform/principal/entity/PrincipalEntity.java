package tech.accesshub.platform.principal.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for the principals table.
 */
@Entity
@Table(name = "principals")
public class PrincipalEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "external_subject_id", nullable = false, unique = true, length = 255)
    public String externalSubjectId;

    @Column(name = "email", nullable = false, unique = true, length = 255)
    public String email;

    @Column(name = "display_name", length = 255)
    public String displayName;

    @Column(name = "first_name", length = 100)
    public String firstName;

    @Column(name = "last_name", length = 100)
    public String lastName;

    @Column(name = "department", length = 255)
    public String department;

    @Column(name = "job_title", length = 255)
    public String jobTitle;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "principal_idp_groups", joinColumns = @JoinColumn(name = "principal_id"))
    @Column(name = "group_name", length = 255)
    public List<String> idpGroups = new ArrayList<>();

    @Column(name = "active", nullable = false)
    public boolean active = true;

    @Column(name = "admin", nullable = false)
    public boolean admin;

    @Column(name = "last_login_at")
    public Instant lastLoginAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public PrincipalEntity() {
    }
}
