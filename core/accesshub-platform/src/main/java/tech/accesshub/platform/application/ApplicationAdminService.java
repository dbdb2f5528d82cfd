package tech.accesshub.platform.application;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;
import tech.accesshub.platform.shared.EntityType;
import tech.accesshub.platform.shared.SecureTokens;
import tech.accesshub.platform.shared.TsidGenerator;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Registration and lifecycle of applications (OAuth clients).
 */
@ApplicationScoped
public class ApplicationAdminService {

    private static final Logger LOG = Logger.getLogger(ApplicationAdminService.class);

    static final String CLIENT_ID_PREFIX = "hub_";
    private static final int CLIENT_ID_BYTES = 16;
    private static final int CLIENT_SECRET_BYTES = 32;
    private static final Pattern SLUG = Pattern.compile("^[a-z0-9]+(?:-[a-z0-9]+)*$");

    @Inject
    ApplicationRepository applicationRepo;

    @Inject
    Clock clock;

    /**
     * Register an application and mint its client credentials.
     *
     * @throws BadRequestException if the name, slug or a redirect URI is invalid, or the slug is taken
     */
    @Transactional
    public RegisteredApplication register(NewApplication request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new BadRequestException("Application name is required");
        }
        if (request.slug() == null || !SLUG.matcher(request.slug()).matches()) {
            throw new BadRequestException("Slug must be lowercase letters, digits and single hyphens");
        }
        if (applicationRepo.existsBySlug(request.slug())) {
            throw new BadRequestException("Slug already exists: " + request.slug());
        }

        String secret = SecureTokens.randomUrlSafe(CLIENT_SECRET_BYTES);

        Application application = new Application();
        application.id = TsidGenerator.generate(EntityType.APPLICATION);
        application.name = request.name().trim();
        application.slug = request.slug();
        application.clientId = CLIENT_ID_PREFIX + SecureTokens.randomUrlSafe(CLIENT_ID_BYTES);
        application.clientSecretHash = SecureTokens.sha256Hex(secret);
        application.redirectUris = normalizeRedirectUris(request.redirectUris());
        application.description = request.description();
        application.baseUrl = request.baseUrl();
        application.iconUrl = request.iconUrl();
        application.publicAccess = request.publicAccess();
        application.createdAt = clock.instant();
        application.updatedAt = application.createdAt;
        applicationRepo.persist(application);

        LOG.infof("Application %s registered with client_id %s", application.slug, application.clientId);
        return new RegisteredApplication(application, secret);
    }

    /**
     * Replace the client secret. The previous secret stops working when this commits.
     *
     * @return the new plain secret
     */
    @Transactional
    public String rotateSecret(String applicationId) {
        requireApplication(applicationId);
        String secret = SecureTokens.randomUrlSafe(CLIENT_SECRET_BYTES);
        applicationRepo.updateSecretHash(applicationId, SecureTokens.sha256Hex(secret), clock.instant());
        LOG.infof("Client secret rotated for application %s", applicationId);
        return secret;
    }

    @Transactional
    public Application update(String applicationId, ApplicationUpdate update) {
        Application application = requireApplication(applicationId);
        if (update.name() != null) {
            if (update.name().isBlank()) {
                throw new BadRequestException("Application name is required");
            }
            application.name = update.name().trim();
        }
        if (update.redirectUris() != null) {
            application.redirectUris = normalizeRedirectUris(update.redirectUris());
        }
        if (update.description() != null) {
            application.description = update.description();
        }
        if (update.baseUrl() != null) {
            application.baseUrl = update.baseUrl();
        }
        if (update.iconUrl() != null) {
            application.iconUrl = update.iconUrl();
        }
        application.updatedAt = clock.instant();
        applicationRepo.update(application);
        return application;
    }

    /**
     * Deactivate an application. Its client can no longer authenticate and nobody can reach it.
     */
    @Transactional
    public Application deactivate(String applicationId) {
        Application application = requireApplication(applicationId);
        application.active = false;
        application.updatedAt = clock.instant();
        applicationRepo.update(application);
        LOG.infof("Application %s deactivated", applicationId);
        return application;
    }

    private Application requireApplication(String applicationId) {
        return applicationRepo.findOptional(applicationId)
            .orElseThrow(() -> new NotFoundException("Application not found: " + applicationId));
    }

    private static List<String> normalizeRedirectUris(List<String> redirectUris) {
        if (redirectUris == null || redirectUris.isEmpty()) {
            throw new BadRequestException("At least one redirect URI is required");
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String uri : redirectUris) {
            if (uri == null || uri.isBlank() || !isAbsolute(uri)) {
                throw new BadRequestException("Redirect URI must be absolute: " + uri);
            }
            unique.add(uri);
        }
        return new ArrayList<>(unique);
    }

    private static boolean isAbsolute(String uri) {
        try {
            return URI.create(uri).isAbsolute();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
