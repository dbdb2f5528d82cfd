package tech.accesshub.platform.authentication.sso;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accesshub.platform.authentication.AuthConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Fetches the discovery document over HTTP.
 */
@ApplicationScoped
public class HttpDiscoveryDocumentFetcher implements DiscoveryDocumentFetcher {

    private static final Logger LOG = Logger.getLogger(HttpDiscoveryDocumentFetcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Inject
    AuthConfig authConfig;

    private HttpClient httpClient;
    private Duration timeout;

    @PostConstruct
    void init() {
        timeout = authConfig.upstream().timeout();
        httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public UpstreamDiscoveryDocument fetch(String discoveryUrl) {
        LOG.debugf("Fetching upstream discovery document from %s", discoveryUrl);
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(discoveryUrl))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new UpstreamIdentityException(
                    "Discovery document request returned HTTP " + response.statusCode());
            }

            UpstreamDiscoveryDocument document = MAPPER.readValue(response.body(), UpstreamDiscoveryDocument.class);
            if (document.authorizationEndpoint() == null || document.tokenEndpoint() == null) {
                throw new UpstreamIdentityException("Discovery document is missing required endpoints");
            }
            return document;

        } catch (IOException e) {
            throw new UpstreamIdentityException("Failed to fetch discovery document: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamIdentityException("Interrupted while fetching discovery document", e);
        }
    }
}
