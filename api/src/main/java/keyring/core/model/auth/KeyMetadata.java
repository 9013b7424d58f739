package keyring.core.model.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Non-secret part of a signing key record, safe to list and log.
 *
 * @param keyId     Key identifier
 * @param createdAt When the key was generated
 * @param active    Whether the key signs new tokens
 */
public record KeyMetadata(String keyId, Instant createdAt, boolean active) {

    public KeyMetadata {
        Objects.requireNonNull(keyId, "keyId is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
    }
}
