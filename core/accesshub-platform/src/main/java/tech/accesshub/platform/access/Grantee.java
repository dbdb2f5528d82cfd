package tech.accesshub.platform.access;

import java.util.Objects;

/**
 * The receiving side of an access grant: exactly one principal or exactly one group.
 */
public sealed interface Grantee permits Grantee.Direct, Grantee.Group {

    GranteeType type();

    /**
     * The principal id for a direct grant, the group id for a group grant.
     */
    String id();

    static Grantee of(GranteeType type, String id) {
        return switch (type) {
            case DIRECT -> new Direct(id);
            case GROUP -> new Group(id);
        };
    }

    record Direct(String principalId) implements Grantee {
        public Direct {
            Objects.requireNonNull(principalId, "principalId");
        }

        @Override
        public GranteeType type() {
            return GranteeType.DIRECT;
        }

        @Override
        public String id() {
            return principalId;
        }
    }

    record Group(String groupId) implements Grantee {
        public Group {
            Objects.requireNonNull(groupId, "groupId");
        }

        @Override
        public GranteeType type() {
            return GranteeType.GROUP;
        }

        @Override
        public String id() {
            return groupId;
        }
    }
}
