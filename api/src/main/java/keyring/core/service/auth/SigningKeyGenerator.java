package keyring.core.service.auth;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.UUID;

import keyring.core.model.auth.SigningKey;

/**
 * Generates fresh RSA signing keys with unique ids.
 *
 * <p>Shared by every key store so that all of them mint ids the same way.
 */
public class SigningKeyGenerator {

    private final int keySize;
    private final Clock clock;

    public SigningKeyGenerator(int keySize) {
        this(keySize, Clock.systemUTC());
    }

    public SigningKeyGenerator(int keySize, Clock clock) {
        if (keySize < 2048) {
            throw new IllegalArgumentException("RSA key size must be at least 2048 bits, got: " + keySize);
        }
        this.keySize = keySize;
        this.clock = clock;
    }

    /**
     * Generate a new active key.
     */
    public SigningKey generate() {
        try {
            final var keyPair = generateKeyPair();
            return SigningKey.active(generateKeyId(), keyPair);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA key generation is not available", e);
        }
    }

    /**
     * Generate a unique key ID.
     *
     * <p>
     * Format: k-{year}-q{quarter}-{uuid without dashes}
     * Example: k-2024-q1-3f0c9a7d2b6e4f1a8c5d0e9b7a6f4c21
     */
    String generateKeyId() {
        final var now = clock.instant().atZone(ZoneOffset.UTC);
        final var quarter = (now.getMonthValue() - 1) / 3 + 1;
        final var uuid = UUID.randomUUID().toString().replace("-", "");
        return String.format("k-%d-q%d-%s", now.getYear(), quarter, uuid);
    }

    private KeyPair generateKeyPair() throws NoSuchAlgorithmException {
        final var keyGen = KeyPairGenerator.getInstance("RSA");
        keyGen.initialize(keySize);
        return keyGen.generateKeyPair();
    }
}
