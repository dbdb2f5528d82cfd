package tech.accesshub.platform.application;

import java.util.List;

/**
 * Registration request for an application.
 */
public record NewApplication(
    String name,
    String slug,
    List<String> redirectUris,
    String description,
    String baseUrl,
    String iconUrl,
    boolean publicAccess
) {}
