package tech.accesshub.platform.access;

/**
 * Discriminator stored alongside a grantee id.
 */
public enum GranteeType {
    DIRECT,
    GROUP
}
