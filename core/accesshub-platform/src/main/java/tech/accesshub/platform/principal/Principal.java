package tech.accesshub.platform.principal;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A local user of the portal, provisioned from the upstream identity provider on first login.
 */
public class Principal {

    public String id;

    /**
     * Subject identifier assigned by the upstream identity provider.
     */
    public String externalSubjectId;

    public String email;

    public String displayName;

    public String firstName;

    public String lastName;

    public String department;

    public String jobTitle;

    /**
     * Group names asserted by the upstream identity provider at the last login.
     * Informational only; access decisions use {@code AccessGroup} membership.
     */
    public List<String> idpGroups = new ArrayList<>();

    public boolean active = true;

    public boolean admin = false;

    public Instant lastLoginAt;

    public Instant createdAt;

    public Instant updatedAt;

    public Principal() {
    }
}
