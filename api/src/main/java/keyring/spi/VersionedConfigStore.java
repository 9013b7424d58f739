package keyring.spi;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * SPI for the versioned configuration store holding key metadata of the
 * vault-backed key store.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Every successful write MUST produce a new version stamp</li>
 *   <li>{@link #setIfVersion} MUST compare and write atomically</li>
 * </ul>
 *
 * @see keyring.adapter.out.storage.redis.RedisVersionedConfigStore
 * @see keyring.adapter.out.storage.memory.InMemoryVersionedConfigStore
 */
public interface VersionedConfigStore {

    String name();

    /**
     * Read a value and its current version.
     *
     * @param key the configuration key
     * @return Uni with the versioned value, empty if absent
     */
    Uni<Optional<VersionedValue>> get(String key);

    /**
     * Write a value unconditionally.
     *
     * @return Uni with the written value and its new version
     */
    Uni<VersionedValue> set(String key, String value);

    /**
     * Write a value only if the stored version still matches.
     *
     * @param key             the configuration key
     * @param value           the new value
     * @param expectedVersion version read earlier, or empty to require that
     *                        the key does not exist yet
     * @return Uni with the written value; fails with
     *         {@link VersionConflictException} if the version moved on
     */
    Uni<VersionedValue> setIfVersion(String key, String value, Optional<String> expectedVersion);

    /**
     * Delete a value. Deleting an absent key succeeds.
     */
    Uni<Void> delete(String key);
}
