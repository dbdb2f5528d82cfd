package tech.accesshub.platform.group;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A named set of principals that can be granted access to applications as a unit.
 */
public class AccessGroup {

    public static final String DEFAULT_COLOR = "#6366f1";

    public String id;

    public String name;

    public String description;

    /**
     * Display color used by the portal (hex, e.g. "#6366f1").
     */
    public String color = DEFAULT_COLOR;

    public Set<String> memberIds = new LinkedHashSet<>();

    public Instant createdAt;

    public Instant updatedAt;

    public AccessGroup() {
    }

    public boolean hasMember(String principalId) {
        return memberIds != null && memberIds.contains(principalId);
    }
}
