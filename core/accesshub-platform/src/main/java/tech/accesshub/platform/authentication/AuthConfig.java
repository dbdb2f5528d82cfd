package tech.accesshub.platform.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the AccessHub authorization server.
 *
 * Example configuration:
 * <pre>
 * accesshub.auth.jwt.issuer=https://hub.example.com
 * accesshub.auth.jwt.private-key-path=/keys/private.pem
 * accesshub.auth.jwt.public-key-path=/keys/public.pem
 * accesshub.auth.upstream.discovery-url=https://login.example.com/.well-known/openid-configuration
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "accesshub.auth")
public interface AuthConfig {

    /**
     * JWT configuration for token issuance and validation.
     */
    JwtConfig jwt();

    /**
     * Session cookie configuration.
     */
    SessionConfig session();

    /**
     * Upstream identity provider configuration.
     */
    UpstreamConfig upstream();

    /**
     * Where unauthenticated authorization requests are sent.
     * The original authorize URL is appended as {@code redirect_to}.
     */
    @WithName("login-url")
    @WithDefault("/auth/sso/login")
    String loginUrl();

    interface JwtConfig {
        /**
         * Token issuer (iss claim).
         * Should match the public URL of the hub.
         */
        @WithDefault("accesshub")
        String issuer();

        /**
         * Path to the RSA private key for signing tokens (PEM format).
         */
        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        /**
         * Path to the RSA public key for validating tokens (PEM format).
         */
        @WithName("public-key-path")
        Optional<String> publicKeyPath();

        /**
         * Directory for generated keys when no key paths are configured.
         */
        @WithName("dev-key-dir")
        @WithDefault(".jwt-keys")
        String devKeyDir();

        @WithName("access-token-expiry")
        @WithDefault("PT1H")
        Duration accessTokenExpiry();

        @WithName("refresh-token-expiry")
        @WithDefault("P7D")
        Duration refreshTokenExpiry();

        /**
         * Lifetime of the portal session token carried in the session cookie.
         */
        @WithName("session-token-expiry")
        @WithDefault("PT1H")
        Duration sessionTokenExpiry();

        @WithName("authorization-code-expiry")
        @WithDefault("PT10M")
        Duration authorizationCodeExpiry();
    }

    interface SessionConfig {
        /**
         * Cookie name for the portal session token.
         */
        @WithName("cookie-name")
        @WithDefault("hub_session")
        String cookieName();
    }

    interface UpstreamConfig {
        /**
         * OpenID discovery document of the upstream identity provider.
         */
        @WithName("discovery-url")
        Optional<String> discoveryUrl();

        /**
         * How long a fetched discovery document is served before it is reloaded.
         */
        @WithName("discovery-cache-ttl")
        @WithDefault("PT1H")
        Duration discoveryCacheTtl();

        /**
         * Connect and request timeout for calls to the upstream provider.
         */
        @WithDefault("PT10S")
        Duration timeout();
    }
}
