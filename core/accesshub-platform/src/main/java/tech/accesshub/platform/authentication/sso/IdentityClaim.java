package tech.accesshub.platform.authentication.sso;

import java.util.List;

/**
 * Claims read from an upstream identity assertion.
 * Each claim lists the names it may arrive under, first match wins.
 */
public enum IdentityClaim {
    SUBJECT(true, "sub", "oid", "upn"),
    EMAIL(true, "email", "upn", "unique_name", "preferred_username"),
    DISPLAY_NAME(false, "name"),
    GIVEN_NAME(false, "given_name"),
    FAMILY_NAME(false, "family_name"),
    DEPARTMENT(false, "department"),
    JOB_TITLE(false, "jobTitle", "job_title", "title"),
    GROUPS(false, "groups");

    private final boolean required;
    private final List<String> names;

    IdentityClaim(boolean required, String... names) {
        this.required = required;
        this.names = List.of(names);
    }

    public boolean required() {
        return required;
    }

    public List<String> names() {
        return names;
    }
}
