package tech.accesshub.platform.application;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An application registered in the portal. Each application is also an OAuth client.
 *
 * The plain client secret is never stored; only its SHA-256 hex digest is.
 */
public class Application {

    public String id;

    public String name;

    /**
     * URL-friendly unique identifier (e.g., "expense-tracker").
     */
    public String slug;

    /**
     * Public OAuth client identifier ("hub_" followed by 16 random bytes, base64url).
     */
    public String clientId;

    public String clientSecretHash;

    /**
     * Registered callback URIs. Matching is exact, no prefix or pattern matching.
     */
    public List<String> redirectUris = new ArrayList<>();

    public String description;

    public String baseUrl;

    public String iconUrl;

    public boolean active = true;

    /**
     * Reachable by every principal without a grant.
     */
    public boolean publicAccess = false;

    public Instant createdAt;

    public Instant updatedAt;

    public Application() {
    }

    public boolean isRedirectUriAllowed(String redirectUri) {
        return redirectUri != null && redirectUris != null && redirectUris.contains(redirectUri);
    }
}
