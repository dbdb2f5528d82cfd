package tech.accesshub.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.accesshub.platform.application.Application;
import tech.accesshub.platform.application.ApplicationRepository;
import tech.accesshub.platform.shared.SecureTokens;

import java.util.Optional;

/**
 * Looks up registered applications as OAuth clients and authenticates them.
 */
@ApplicationScoped
public class ClientRegistry {

    // Compared against when the client_id is unknown, so both failures cost one hash and one compare
    private static final String UNKNOWN_CLIENT_HASH = SecureTokens.sha256Hex("unknown-client");

    @Inject
    ApplicationRepository applicationRepo;

    /**
     * Find an active application by its client_id.
     */
    public Optional<Application> findActive(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            return Optional.empty();
        }
        return applicationRepo.findByClientId(clientId).filter(app -> app.active);
    }

    /**
     * Authenticate a confidential client.
     *
     * @return the authenticated application
     * @throws OAuthException {@code invalid_client} for missing credentials, an unknown or inactive
     *                        client_id, or a wrong secret, without telling them apart
     */
    public Application authenticate(ClientCredentials credentials) {
        if (credentials == null || !credentials.isComplete()) {
            throw OAuthException.invalidClient("Client credentials missing",
                credentials != null && credentials.basicAuthentication());
        }

        Optional<Application> application = findActive(credentials.clientId());
        String expectedHash = application.map(app -> app.clientSecretHash).orElse(UNKNOWN_CLIENT_HASH);
        boolean secretMatches = SecureTokens.constantTimeEquals(expectedHash, SecureTokens.sha256Hex(credentials.clientSecret()));

        if (application.isEmpty()) {
            throw OAuthException.invalidClient("Unknown or inactive client_id " + credentials.clientId(),
                credentials.basicAuthentication());
        }
        if (!secretMatches) {
            throw OAuthException.invalidClient("Wrong secret for client_id " + credentials.clientId(),
                credentials.basicAuthentication());
        }
        return application.get();
    }

    /**
     * Exact match against the registered redirect URIs. No prefix, wildcard or normalization.
     */
    public boolean isRedirectUriAllowed(Application application, String redirectUri) {
        return application != null && application.isRedirectUriAllowed(redirectUri);
    }
}
