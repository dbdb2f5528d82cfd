package tech.accesshub.platform.authentication;

import io.smallrye.jwt.auth.principal.DefaultJWTParser;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.build.Jwt;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonString;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Service for managing JWT signing keys and generating tokens.
 *
 * Supports two modes:
 * 1. File-based keys (production) - loads PEM keys from the configured paths
 * 2. Dev keys - loads keys persisted in the dev key directory, or generates and persists a new pair
 *
 * Issues OAuth access tokens and portal session tokens, verifies both, and publishes the JWKS
 * and OpenID discovery document.
 */
@ApplicationScoped
public class JwtKeyService {

    private static final Logger LOG = Logger.getLogger(JwtKeyService.class);
    private static final String ALGORITHM = "RS256";
    private static final int KEY_SIZE = 2048;

    static final String TYPE_CLAIM = "type";
    static final String ACCESS_TOKEN_TYPE = "oauth_access";
    static final String SESSION_TOKEN_TYPE = "session";

    @Inject
    AuthConfig authConfig;

    @Inject
    Clock clock;

    private RSAPrivateKey privateKey;
    private RSAPublicKey publicKey;
    private String keyId;

    @PostConstruct
    void init() {
        AuthConfig.JwtConfig jwt = authConfig.jwt();
        try {
            if (jwt.privateKeyPath().isPresent() && jwt.publicKeyPath().isPresent()) {
                loadKeysFromFiles(jwt.privateKeyPath().get(), jwt.publicKeyPath().get());
            } else {
                loadOrGenerateDevKeys(jwt.devKeyDir());
            }
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize JWT keys", e);
        }
        this.keyId = generateKeyId(publicKey);
        LOG.infof("JWT key service initialized with key ID: %s", keyId);
    }

    /**
     * Replace the signing key pair. Used when keys are provisioned outside the config paths.
     */
    void useKeyPair(KeyPair keyPair) {
        this.privateKey = (RSAPrivateKey) keyPair.getPrivate();
        this.publicKey = (RSAPublicKey) keyPair.getPublic();
        this.keyId = generateKeyId(publicKey);
    }

    private void loadOrGenerateDevKeys(String devKeyDir) throws IOException, GeneralSecurityException {
        Path keyDir = Path.of(devKeyDir);
        Path privateKeyFile = keyDir.resolve("private.key");
        Path publicKeyFile = keyDir.resolve("public.key");

        if (Files.exists(privateKeyFile) && Files.exists(publicKeyFile)) {
            LOG.infof("Loading persisted dev JWT keys from %s", devKeyDir);
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            this.privateKey = (RSAPrivateKey) keyFactory.generatePrivate(
                new PKCS8EncodedKeySpec(Files.readAllBytes(privateKeyFile)));
            this.publicKey = (RSAPublicKey) keyFactory.generatePublic(
                new X509EncodedKeySpec(Files.readAllBytes(publicKeyFile)));
        } else {
            LOG.infof("Generating new dev JWT keys (will be persisted to %s)", devKeyDir);
            useKeyPair(generateKeyPair());
            Files.createDirectories(keyDir);
            Files.write(privateKeyFile, privateKey.getEncoded());
            Files.write(publicKeyFile, publicKey.getEncoded());
        }
        LOG.warn("Using dev JWT keys. Configure accesshub.auth.jwt.private-key-path and "
            + "accesshub.auth.jwt.public-key-path for production.");
    }

    private void loadKeysFromFiles(String privatePath, String publicPath) throws IOException, GeneralSecurityException {
        LOG.info("Loading JWT keys from files");

        String privateKeyPem = Files.readString(Path.of(privatePath), StandardCharsets.UTF_8);
        String publicKeyPem = Files.readString(Path.of(publicPath), StandardCharsets.UTF_8);

        KeyFactory keyFactory = KeyFactory.getInstance("RSA");
        this.privateKey = (RSAPrivateKey) keyFactory.generatePrivate(
            new PKCS8EncodedKeySpec(parsePemKey(privateKeyPem, "PRIVATE KEY")));
        this.publicKey = (RSAPublicKey) keyFactory.generatePublic(
            new X509EncodedKeySpec(parsePemKey(publicKeyPem, "PUBLIC KEY")));
    }

    private byte[] parsePemKey(String pem, String type) {
        String base64 = pem
                .replace("-----BEGIN " + type + "-----", "")
                .replace("-----END " + type + "-----", "")
                .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    static KeyPair generateKeyPair() throws NoSuchAlgorithmException {
        KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
        keyGen.initialize(KEY_SIZE, new SecureRandom());
        return keyGen.generateKeyPair();
    }

    private String generateKeyId(RSAPublicKey key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getEncoded());
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ==================== Issuance ====================

    /**
     * Issue an OAuth access token for a token pair.
     *
     * @param tokenId   the token pair id, carried as {@code jti}
     * @param subjectId the principal id ({@code sub})
     * @param clientId  the application's client_id ({@code aud})
     * @param scope     space-separated granted scopes
     * @param issuedAt  the pair's issue instant
     * @param expiresAt the pair's access expiry
     */
    public String issueAccessToken(String tokenId, String subjectId, String clientId, String scope,
            Instant issuedAt, Instant expiresAt) {
        return Jwt.issuer(authConfig.jwt().issuer())
                .subject(subjectId)
                .audience(clientId)
                .claim("jti", tokenId)
                .claim("scope", scope)
                .claim(TYPE_CLAIM, ACCESS_TOKEN_TYPE)
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .jws()
                .keyId(keyId)
                .sign(privateKey);
    }

    /**
     * Issue a portal session token for a principal.
     * The portal login flow places it in the session cookie.
     */
    public String issueSessionToken(String principalId) {
        Instant now = clock.instant();
        return Jwt.issuer(authConfig.jwt().issuer())
                .subject(principalId)
                .claim(TYPE_CLAIM, SESSION_TOKEN_TYPE)
                .issuedAt(now)
                .expiresAt(now.plus(authConfig.jwt().sessionTokenExpiry()))
                .jws()
                .keyId(keyId)
                .sign(privateKey);
    }

    // ==================== Verification ====================

    /**
     * Verify signature, issuer, type and expiry of an access token.
     *
     * @return the token's claims, or empty when the token is not a valid access token
     */
    public Optional<AccessTokenClaims> verifyAccessToken(String token) {
        return verify(token, ACCESS_TOKEN_TYPE).map(jwt -> {
            Set<String> audience = jwt.getAudience();
            String clientId = audience == null || audience.isEmpty() ? null : audience.iterator().next();
            return new AccessTokenClaims(
                jwt.getTokenID(),
                jwt.getSubject(),
                clientId,
                claimAsString(jwt.getClaim("scope")),
                Instant.ofEpochSecond(jwt.getExpirationTime()));
        });
    }

    /**
     * Validate a session token and extract the principal id.
     *
     * @return the principal id, or empty if the token is invalid, expired or not a session token
     */
    public Optional<String> validateSessionToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return verify(token, SESSION_TOKEN_TYPE).map(JsonWebToken::getSubject);
    }

    private Optional<JsonWebToken> verify(String token, String expectedType) {
        try {
            JWTParser parser = new DefaultJWTParser();
            JsonWebToken jwt = parser.verify(token, publicKey);

            String issuer = authConfig.jwt().issuer();
            if (!issuer.equals(jwt.getIssuer())) {
                LOG.debugf("Token issuer mismatch: expected %s, got %s", issuer, jwt.getIssuer());
                return Optional.empty();
            }

            String type = claimAsString(jwt.getClaim(TYPE_CLAIM));
            if (!expectedType.equals(type)) {
                LOG.debugf("Token type mismatch: expected %s, got %s", expectedType, type);
                return Optional.empty();
            }

            if (jwt.getExpirationTime() <= clock.instant().getEpochSecond()) {
                LOG.debug("Token expired");
                return Optional.empty();
            }

            return Optional.of(jwt);
        } catch (Exception e) {
            LOG.debugf("Token validation failed: %s", e.getMessage());
            return Optional.empty();
        }
    }

    private static String claimAsString(Object claim) {
        if (claim == null) {
            return null;
        }
        if (claim instanceof JsonString jsonString) {
            return jsonString.getString();
        }
        return claim.toString();
    }

    // ==================== Publication ====================

    /**
     * Get the JWKS (JSON Web Key Set) for token verification.
     */
    public Map<String, Object> getJwks() {
        return Map.of("keys", List.of(getJwk()));
    }

    /**
     * Get the JWK (JSON Web Key) for the current public key.
     */
    public Map<String, Object> getJwk() {
        Map<String, Object> jwk = new LinkedHashMap<>();
        jwk.put("kty", "RSA");
        jwk.put("alg", ALGORITHM);
        jwk.put("use", "sig");
        jwk.put("kid", keyId);
        jwk.put("n", base64UrlUnsigned(publicKey.getModulus().toByteArray()));
        jwk.put("e", base64UrlUnsigned(publicKey.getPublicExponent().toByteArray()));
        return jwk;
    }

    private static String base64UrlUnsigned(byte[] bytes) {
        // Remove leading zero byte if present (BigInteger sign bit)
        if (bytes.length > 1 && bytes[0] == 0) {
            byte[] tmp = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, tmp, 0, tmp.length);
            bytes = tmp;
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Get the OpenID Connect discovery document.
     */
    public Map<String, Object> getOpenIdConfiguration(String baseUrl) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("issuer", authConfig.jwt().issuer());
        config.put("authorization_endpoint", baseUrl + "/oauth/authorize");
        config.put("token_endpoint", baseUrl + "/oauth/token");
        config.put("userinfo_endpoint", baseUrl + "/oauth/userinfo");
        config.put("revocation_endpoint", baseUrl + "/oauth/revoke");
        config.put("jwks_uri", baseUrl + "/.well-known/jwks.json");
        config.put("response_types_supported", List.of("code"));
        config.put("grant_types_supported", List.of("authorization_code", "refresh_token"));
        config.put("scopes_supported", List.of("openid", "profile", "email"));
        config.put("token_endpoint_auth_methods_supported", List.of("client_secret_post", "client_secret_basic"));
        config.put("subject_types_supported", List.of("public"));
        config.put("id_token_signing_alg_values_supported", List.of(ALGORITHM));
        config.put("claims_supported", List.of("sub", "email", "name", "preferred_username", "groups"));
        return config;
    }

    public String getIssuer() {
        return authConfig.jwt().issuer();
    }

    public String getKeyId() {
        return keyId;
    }
}
