package keyring.spi;

/**
 * Thrown when a key lookup by id finds nothing.
 */
public class KeyNotFoundException extends KeyStoreException {

    private final String keyId;

    public KeyNotFoundException(String keyId) {
        super("Key not found: " + keyId);
        this.keyId = keyId;
    }

    public String getKeyId() {
        return keyId;
    }
}
