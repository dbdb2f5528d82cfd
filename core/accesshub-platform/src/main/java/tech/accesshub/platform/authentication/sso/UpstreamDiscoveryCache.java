package tech.accesshub.platform.authentication.sso;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.accesshub.platform.authentication.AuthConfig;

import java.time.Duration;

/**
 * Holds the upstream discovery document for a fixed time after each successful load.
 *
 * <p>An expired entry is reloaded on the next read. A failed load is never cached and
 * never answered with the previous document; the caller sees the failure.</p>
 */
@ApplicationScoped
public class UpstreamDiscoveryCache {

    private static final Logger LOG = Logger.getLogger(UpstreamDiscoveryCache.class);

    @Inject
    AuthConfig authConfig;

    @Inject
    DiscoveryDocumentFetcher fetcher;

    private String discoveryUrl;
    private LoadingCache<String, UpstreamDiscoveryDocument> cache;

    UpstreamDiscoveryCache() {
    }

    UpstreamDiscoveryCache(DiscoveryDocumentFetcher fetcher, String discoveryUrl, Duration ttl, Ticker ticker) {
        this.fetcher = fetcher;
        configure(discoveryUrl, ttl, ticker);
    }

    @PostConstruct
    void init() {
        var upstream = authConfig.upstream();
        configure(upstream.discoveryUrl().orElse(null), upstream.discoveryCacheTtl(), Ticker.systemTicker());
    }

    private void configure(String discoveryUrl, Duration ttl, Ticker ticker) {
        this.discoveryUrl = discoveryUrl;
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(1)
            .ticker(ticker)
            .build(this::load);
        LOG.infof("Upstream discovery cache initialized: url=%s, TTL=%s", discoveryUrl, ttl);
    }

    /**
     * The current discovery document, loading it if absent or expired.
     *
     * @throws UpstreamIdentityException if no discovery URL is configured or the load fails
     */
    public UpstreamDiscoveryDocument current() {
        if (discoveryUrl == null || discoveryUrl.isBlank()) {
            throw new UpstreamIdentityException("No upstream discovery URL is configured");
        }
        return cache.get(discoveryUrl);
    }

    /**
     * Drop the cached document so the next read fetches it again.
     */
    public void invalidate() {
        cache.invalidateAll();
        LOG.debug("Upstream discovery document invalidated");
    }

    private UpstreamDiscoveryDocument load(String url) {
        UpstreamDiscoveryDocument document = fetcher.fetch(url);
        LOG.infof("Loaded upstream discovery document, issuer=%s", document.issuer());
        return document;
    }
}
