package tech.accesshub.platform.access;

import java.util.Set;

/**
 * Who can reach one application.
 *
 * @param applicationId      the application
 * @param publicAccess       every principal can reach it
 * @param directPrincipalIds principals granted directly
 * @param groupIds           groups granted
 * @param effectivePrincipalIds direct principals plus the members of granted groups;
 *                           when {@code publicAccess} is set this is not exhaustive
 */
public record ApplicationAccess(
    String applicationId,
    boolean publicAccess,
    Set<String> directPrincipalIds,
    Set<String> groupIds,
    Set<String> effectivePrincipalIds
) {}
