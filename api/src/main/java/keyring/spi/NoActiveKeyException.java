package keyring.spi;

/**
 * Thrown when a store has no active signing key.
 *
 * <p>Outside of a startup race this means the store state is corrupted or the
 * active key was retired without rotating first.
 */
public class NoActiveKeyException extends KeyStoreException {

    public NoActiveKeyException(String message) {
        super(message);
    }
}
