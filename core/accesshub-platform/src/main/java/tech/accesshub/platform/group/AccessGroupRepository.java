package tech.accesshub.platform.group;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for AccessGroup entities.
 */
public interface AccessGroupRepository {

    // Read operations
    Optional<AccessGroup> findOptional(String id);
    Optional<AccessGroup> findByName(String name);
    List<AccessGroup> findByIds(Collection<String> ids);
    List<AccessGroup> listAllGroups();
    Set<String> findGroupIdsByMember(String principalId);

    // Write operations
    void persist(AccessGroup group);
    void update(AccessGroup group);
    boolean deleteGroup(String id);
}
