package tech.accesshub.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for all entities.
 *
 * IDs are stored and transmitted as typed IDs with 3-character prefixes.
 * Format: "{prefix}_{tsid}" (e.g., "prn_0HZXEQ5Y8JY5Z")
 *
 * The TSID part is time-sortable, so records of one type sort in creation order.
 */
public final class TsidGenerator {

    /**
     * Separator between prefix and TSID.
     */
    public static final String SEPARATOR = "_";

    private TsidGenerator() {
    }

    /**
     * Generate a new typed ID for the given entity type.
     *
     * @param type the entity type
     * @return the prefixed ID (e.g., "acd_0HZXEQ5Y8JY5Z")
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Extract the entity type from a typed ID.
     *
     * @param typedId the typed ID (e.g., "grp_0HZXEQ5Y8JY5Z")
     * @return the entity type
     * @throws IllegalArgumentException if the ID has no separator or an unknown prefix
     */
    public static EntityType typeOf(String typedId) {
        if (typedId == null || typedId.isBlank()) {
            throw new IllegalArgumentException("Typed ID cannot be null or blank");
        }
        int separatorIndex = typedId.indexOf(SEPARATOR);
        if (separatorIndex == -1) {
            throw new IllegalArgumentException("Invalid typed ID format: missing separator");
        }
        EntityType type = EntityType.fromPrefix(typedId.substring(0, separatorIndex));
        if (type == null) {
            throw new IllegalArgumentException("Unknown typed ID prefix: " + typedId.substring(0, separatorIndex));
        }
        return type;
    }
}
