package keyring.spi;

/**
 * Thrown by {@link VersionedConfigStore#setIfVersion} when the stored version
 * no longer matches the expected one.
 */
public class VersionConflictException extends KeyStoreException {

    private final String key;

    public VersionConflictException(String key) {
        super("Concurrent modification of configuration key: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
