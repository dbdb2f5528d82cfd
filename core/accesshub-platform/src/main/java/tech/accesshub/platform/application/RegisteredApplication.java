package tech.accesshub.platform.application;

/**
 * Result of registering an application or rotating its secret.
 * The plain secret is only available here; it is not recoverable afterwards.
 */
public record RegisteredApplication(Application application, String clientSecret) {}
