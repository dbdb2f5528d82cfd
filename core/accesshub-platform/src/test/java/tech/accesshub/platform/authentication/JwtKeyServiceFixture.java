package tech.accesshub.platform.authentication;

import java.security.KeyPair;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;

/**
 * Builds a {@link JwtKeyService} outside the container, signing with an in-memory key pair.
 */
public final class JwtKeyServiceFixture {

    private static final KeyPair KEY_PAIR = newKeyPair();

    private JwtKeyServiceFixture() {
    }

    public static JwtKeyService create(AuthConfig authConfig, Clock clock) {
        return create(authConfig, clock, KEY_PAIR);
    }

    public static JwtKeyService create(AuthConfig authConfig, Clock clock, KeyPair keyPair) {
        JwtKeyService service = new JwtKeyService();
        service.authConfig = authConfig;
        service.clock = clock;
        service.useKeyPair(keyPair);
        return service;
    }

    public static KeyPair newKeyPair() {
        try {
            return JwtKeyService.generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
