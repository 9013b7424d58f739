package keyring.spi;

/**
 * Thrown when optimistic rotation lost every attempt to a concurrent writer.
 */
public class RotationConflictException extends KeyStoreException {

    public RotationConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
