package keyring.core.model.auth;

/**
 * Why a download token was rejected.
 *
 * <p>These are kept for logging only. Callers outside the core must treat every
 * value identically as "unauthorized" so the failure mode is not leaked.
 */
public enum VerificationFailure {
    MISSING_TOKEN,
    MALFORMED_TOKEN,
    UNKNOWN_SIGNING_KEY,
    INVALID_SIGNATURE,
    TOKEN_EXPIRED,
    INVALID_CLAIMS
}
