package tech.accesshub.platform.access;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;
import tech.accesshub.platform.application.Application;
import tech.accesshub.platform.application.ApplicationRepository;
import tech.accesshub.platform.group.AccessGroup;
import tech.accesshub.platform.group.AccessGroupRepository;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read side of access control: loads grants and memberships and asks the {@link AccessEvaluator}.
 */
@ApplicationScoped
public class AccessQueryService {

    @Inject
    ApplicationRepository applicationRepo;

    @Inject
    AccessGroupRepository groupRepo;

    @Inject
    AccessGrantRepository grantRepo;

    @Inject
    AccessEvaluator evaluator;

    public boolean canAccess(String subjectId, String applicationId) {
        return applicationRepo.findOptional(applicationId)
            .map(application -> canAccess(subjectId, application))
            .orElse(false);
    }

    public boolean canAccess(String subjectId, Application application) {
        Set<String> groupIds = groupRepo.findGroupIdsByMember(subjectId);
        List<AccessGrant> grants = grantRepo.findForSubject(subjectId, groupIds);
        return evaluator.canAccess(subjectId, application, groupIds, grants);
    }

    /**
     * Active applications the subject can reach, ordered by name. Backs the portal dashboard.
     */
    public List<Application> accessibleApplications(String subjectId) {
        Set<String> groupIds = groupRepo.findGroupIdsByMember(subjectId);
        List<AccessGrant> grants = grantRepo.findForSubject(subjectId, groupIds);

        Set<String> candidateIds = new LinkedHashSet<>();
        applicationRepo.findPublicActive().forEach(app -> candidateIds.add(app.id));
        grants.forEach(grant -> candidateIds.add(grant.applicationId));

        return applicationRepo.findByIds(candidateIds).stream()
            .filter(app -> evaluator.canAccess(subjectId, app, groupIds, grants))
            .sorted(Comparator.comparing(app -> app.name, String.CASE_INSENSITIVE_ORDER))
            .toList();
    }

    /**
     * Describe who can reach an application.
     *
     * @throws NotFoundException if the application does not exist
     */
    public ApplicationAccess describeAccess(String applicationId) {
        Application application = applicationRepo.findOptional(applicationId)
            .orElseThrow(() -> new NotFoundException("Application not found: " + applicationId));

        List<AccessGrant> grants = grantRepo.findByApplicationId(applicationId);

        Set<String> directIds = grants.stream()
            .filter(grant -> grant.grantee instanceof Grantee.Direct)
            .map(grant -> grant.grantee.id())
            .collect(Collectors.toCollection(LinkedHashSet::new));

        Set<String> groupIds = grants.stream()
            .filter(grant -> grant.grantee instanceof Grantee.Group)
            .map(grant -> grant.grantee.id())
            .collect(Collectors.toCollection(LinkedHashSet::new));

        Set<String> effective = new LinkedHashSet<>(directIds);
        for (AccessGroup group : groupRepo.findByIds(groupIds)) {
            effective.addAll(group.memberIds);
        }

        return new ApplicationAccess(
            application.id,
            application.publicAccess,
            Set.copyOf(directIds),
            Set.copyOf(groupIds),
            Set.copyOf(effective));
    }
}
