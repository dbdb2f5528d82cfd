package tech.accesshub.platform.authentication.sso;

/**
 * Loads an upstream discovery document.
 */
public interface DiscoveryDocumentFetcher {

    /**
     * @throws UpstreamIdentityException if the document cannot be fetched or parsed
     */
    UpstreamDiscoveryDocument fetch(String discoveryUrl);
}
