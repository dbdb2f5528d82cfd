package tech.accesshub.platform.group.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * JPA entity for the access_groups table.
 */
@Entity
@Table(name = "access_groups")
public class AccessGroupEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    public String name;

    @Column(name = "description", length = 2000)
    public String description;

    @Column(name = "color", nullable = false, length = 7)
    public String color;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "access_group_members", joinColumns = @JoinColumn(name = "group_id"))
    @Column(name = "principal_id", length = 17)
    public Set<String> memberIds = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public AccessGroupEntity() {
    }
}
