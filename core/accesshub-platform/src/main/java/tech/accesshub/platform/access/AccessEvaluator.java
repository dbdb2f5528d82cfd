package tech.accesshub.platform.access;

import jakarta.enterprise.context.ApplicationScoped;
import tech.accesshub.platform.application.Application;

import java.util.Collection;
import java.util.Set;

/**
 * Decides whether a subject may reach an application.
 *
 * <p>A subject reaches an active application when any of these hold:
 * <ol>
 *   <li>the application is public</li>
 *   <li>a direct grant names the subject</li>
 *   <li>a group grant names a group the subject belongs to</li>
 * </ol>
 *
 * <p>Inactive applications are never reachable. Adding a grant or a membership never
 * removes access. The decision reads only its arguments.
 */
@ApplicationScoped
public class AccessEvaluator {

    public boolean canAccess(String subjectId, Application application,
            Set<String> subjectGroupIds, Collection<AccessGrant> grants) {
        if (application == null || !application.active) {
            return false;
        }
        if (application.publicAccess) {
            return true;
        }
        if (grants == null) {
            return false;
        }
        for (AccessGrant grant : grants) {
            if (!application.id.equals(grant.applicationId)) {
                continue;
            }
            if (grants(grant.grantee, subjectId, subjectGroupIds)) {
                return true;
            }
        }
        return false;
    }

    private static boolean grants(Grantee grantee, String subjectId, Set<String> subjectGroupIds) {
        if (grantee instanceof Grantee.Direct direct) {
            return direct.principalId().equals(subjectId);
        }
        if (grantee instanceof Grantee.Group group) {
            return subjectGroupIds != null && subjectGroupIds.contains(group.groupId());
        }
        return false;
    }
}
