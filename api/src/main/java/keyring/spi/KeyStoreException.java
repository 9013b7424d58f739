package keyring.spi;

/**
 * Base class for key store failures.
 */
public class KeyStoreException extends RuntimeException {

    public KeyStoreException(String message) {
        super(message);
    }

    public KeyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
