package keyring.core.model.auth;

import java.time.Instant;

/**
 * Result of verifying a download token.
 */
public sealed interface LinkVerificationResult {

    /**
     * Token signature and claims checked out.
     *
     * @param email     principal the link was issued to
     * @param filePath  file the link grants access to
     * @param keyId     id of the key that verified the signature
     * @param expiresAt when the token expires
     */
    record Valid(String email, String filePath, String keyId, Instant expiresAt) implements LinkVerificationResult {}

    /**
     * Token was rejected.
     *
     * @param failure internal reason, never exposed to callers
     */
    record Unauthorized(VerificationFailure failure) implements LinkVerificationResult {}

    default boolean isValid() {
        return this instanceof Valid;
    }
}
