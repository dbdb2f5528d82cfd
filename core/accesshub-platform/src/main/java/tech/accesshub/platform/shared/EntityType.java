package tech.accesshub.platform.shared;

import java.util.HashMap;
import java.util.Map;

/**
 * Entity types stored by the hub, each with its 3-character ID prefix.
 *
 * IDs are stored WITH the prefix in the database:
 * - Format: "{prefix}_{tsid}" (e.g., "app_0HZXEQ5Y8JY5Z")
 * - Total length: 17 characters (3-char prefix + underscore + 13-char TSID)
 *
 * Usage:
 * <pre>
 * String id = TsidGenerator.generate(EntityType.APPLICATION);  // "app_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    // Directory
    APPLICATION("app"),
    PRINCIPAL("prn"),
    ACCESS_GROUP("grp"),
    ACCESS_GRANT("gnt"),

    // OAuth
    AUTH_CODE("acd"),
    TOKEN_PAIR("tkp"),
    TOKEN_LINEAGE("tkl");

    private static final Map<String, EntityType> BY_PREFIX = new HashMap<>();

    static {
        for (EntityType type : values()) {
            BY_PREFIX.put(type.prefix, type);
        }
    }

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Returns the prefix used in serialized IDs (e.g., "app" for APPLICATION).
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Looks up an EntityType by its prefix.
     *
     * @return the matching type, or null when the prefix is unknown
     */
    public static EntityType fromPrefix(String prefix) {
        return BY_PREFIX.get(prefix);
    }
}
