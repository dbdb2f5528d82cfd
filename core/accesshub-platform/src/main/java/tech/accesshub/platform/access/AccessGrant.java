package tech.accesshub.platform.access;

import java.time.Instant;

/**
 * Grants a principal or a group access to an application.
 */
public class AccessGrant {

    public String id;

    public Grantee grantee;

    public String applicationId;

    public Instant grantedAt;

    /**
     * Principal id of the administrator who created the grant, if known.
     */
    public String grantedBy;

    public AccessGrant() {
    }

    public AccessGrant(String id, Grantee grantee, String applicationId, Instant grantedAt, String grantedBy) {
        this.id = id;
        this.grantee = grantee;
        this.applicationId = applicationId;
        this.grantedAt = grantedAt;
        this.grantedBy = grantedBy;
    }
}
