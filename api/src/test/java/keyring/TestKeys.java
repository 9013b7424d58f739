package keyring;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;

import keyring.core.model.auth.SigningKey;

/**
 * Shared RSA material for tests. Key generation is slow, so one pair is
 * reused wherever the key bytes do not matter.
 */
public final class TestKeys {

    private static final KeyPair KEY_PAIR = generate();

    private TestKeys() {}

    public static KeyPair generate() {
        try {
            final var keyGen = KeyPairGenerator.getInstance("RSA");
            keyGen.initialize(2048);
            return keyGen.generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    public static SigningKey signingKey(String keyId, boolean active) {
        return new SigningKey(
                keyId,
                (RSAPrivateKey) KEY_PAIR.getPrivate(),
                (RSAPublicKey) KEY_PAIR.getPublic(),
                Instant.parse("2024-01-01T00:00:00Z"),
                active);
    }
}
