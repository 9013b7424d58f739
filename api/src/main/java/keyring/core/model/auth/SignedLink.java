package keyring.core.model.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * A freshly signed download token.
 *
 * @param token     compact JWS serialization
 * @param keyId     id of the key that signed it
 * @param issuedAt  token issue time
 * @param expiresAt token expiry
 */
public record SignedLink(String token, String keyId, Instant issuedAt, Instant expiresAt) {

    public Duration lifetime() {
        return Duration.between(issuedAt, expiresAt);
    }
}
