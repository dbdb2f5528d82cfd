package tech.accesshub.platform.application.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for the applications table.
 */
@Entity
@Table(name = "applications")
public class ApplicationEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "name", nullable = false, length = 200)
    public String name;

    @Column(name = "slug", nullable = false, unique = true, length = 100)
    public String slug;

    @Column(name = "client_id", nullable = false, unique = true, length = 50)
    public String clientId;

    @Column(name = "client_secret_hash", nullable = false, length = 64)
    public String clientSecretHash;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "application_redirect_uris", joinColumns = @JoinColumn(name = "application_id"))
    @OrderColumn(name = "position")
    @Column(name = "redirect_uri", length = 2000)
    public List<String> redirectUris = new ArrayList<>();

    @Column(name = "description", length = 2000)
    public String description;

    @Column(name = "base_url", length = 500)
    public String baseUrl;

    @Column(name = "icon_url", length = 500)
    public String iconUrl;

    @Column(name = "active", nullable = false)
    public boolean active = true;

    @Column(name = "public_access", nullable = false)
    public boolean publicAccess;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public ApplicationEntity() {
    }
}
