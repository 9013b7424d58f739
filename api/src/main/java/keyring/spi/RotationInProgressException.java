package keyring.spi;

/**
 * Thrown when the rotation lock could not be acquired within the configured wait.
 *
 * <p>Another instance is rotating. Callers should retry later with backoff.
 */
public class RotationInProgressException extends KeyStoreException {

    public RotationInProgressException(String message) {
        super(message);
    }
}
