package tech.accesshub.platform.application;

import java.util.List;

/**
 * Partial update of an application. Null components leave the field unchanged.
 */
public record ApplicationUpdate(
    String name,
    List<String> redirectUris,
    String description,
    String baseUrl,
    String iconUrl
) {}
