package tech.accesshub.platform.group;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;
import tech.accesshub.platform.access.AccessGrantRepository;
import tech.accesshub.platform.access.Grantee;
import tech.accesshub.platform.principal.PrincipalRepository;
import tech.accesshub.platform.shared.EntityType;
import tech.accesshub.platform.shared.TsidGenerator;

import java.time.Clock;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Group management: CRUD and membership.
 */
@ApplicationScoped
public class AccessGroupService {

    private static final Logger LOG = Logger.getLogger(AccessGroupService.class);
    private static final Pattern COLOR = Pattern.compile("^#[0-9a-fA-F]{6}$");

    @Inject
    AccessGroupRepository groupRepo;

    @Inject
    AccessGrantRepository grantRepo;

    @Inject
    PrincipalRepository principalRepo;

    @Inject
    Clock clock;

    public List<AccessGroup> listGroups() {
        return groupRepo.listAllGroups();
    }

    public AccessGroup getGroup(String groupId) {
        return requireGroup(groupId);
    }

    /**
     * Create an empty group.
     *
     * @param color hex color, or null for the default
     * @throws BadRequestException if the name is blank or taken, or the color is malformed
     */
    @Transactional
    public AccessGroup createGroup(String name, String description, String color) {
        String trimmedName = requireName(name);
        if (groupRepo.findByName(trimmedName).isPresent()) {
            throw new BadRequestException("Group name already exists: " + trimmedName);
        }

        AccessGroup group = new AccessGroup();
        group.id = TsidGenerator.generate(EntityType.ACCESS_GROUP);
        group.name = trimmedName;
        group.description = description;
        group.color = color != null ? requireColor(color) : AccessGroup.DEFAULT_COLOR;
        group.createdAt = clock.instant();
        group.updatedAt = group.createdAt;
        groupRepo.persist(group);

        LOG.infof("Access group %s created: %s", group.id, group.name);
        return group;
    }

    /**
     * Rename or re-describe a group. Null arguments leave the field unchanged.
     */
    @Transactional
    public AccessGroup updateGroup(String groupId, String name, String description, String color) {
        AccessGroup group = requireGroup(groupId);

        if (name != null) {
            String trimmedName = requireName(name);
            groupRepo.findByName(trimmedName)
                .filter(other -> !other.id.equals(groupId))
                .ifPresent(other -> {
                    throw new BadRequestException("Group name already exists: " + trimmedName);
                });
            group.name = trimmedName;
        }
        if (description != null) {
            group.description = description;
        }
        if (color != null) {
            group.color = requireColor(color);
        }
        group.updatedAt = clock.instant();
        groupRepo.update(group);
        return group;
    }

    /**
     * Delete a group together with every grant it holds.
     */
    @Transactional
    public void deleteGroup(String groupId) {
        requireGroup(groupId);
        long grants = grantRepo.deleteByGrantee(new Grantee.Group(groupId));
        groupRepo.deleteGroup(groupId);
        LOG.infof("Access group %s deleted with %d grant(s)", groupId, grants);
    }

    @Transactional
    public AccessGroup addMember(String groupId, String principalId) {
        AccessGroup group = requireGroup(groupId);
        if (principalRepo.findOptional(principalId).isEmpty()) {
            throw new NotFoundException("Principal not found: " + principalId);
        }
        if (group.memberIds.add(principalId)) {
            group.updatedAt = clock.instant();
            groupRepo.update(group);
        }
        return group;
    }

    @Transactional
    public AccessGroup removeMember(String groupId, String principalId) {
        AccessGroup group = requireGroup(groupId);
        if (group.memberIds.remove(principalId)) {
            group.updatedAt = clock.instant();
            groupRepo.update(group);
        }
        return group;
    }

    private AccessGroup requireGroup(String groupId) {
        return groupRepo.findOptional(groupId)
            .orElseThrow(() -> new NotFoundException("Group not found: " + groupId));
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new BadRequestException("Group name is required");
        }
        return name.trim();
    }

    private static String requireColor(String color) {
        if (!COLOR.matcher(color).matches()) {
            throw new BadRequestException("Color must be a hex value like #6366f1");
        }
        return color;
    }
}
