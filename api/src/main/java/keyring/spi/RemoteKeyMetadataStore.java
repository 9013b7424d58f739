package keyring.spi;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import keyring.core.model.auth.SigningKey;

/**
 * SPI for the shared backend behind the distributed key store.
 *
 * <p>The backend is an opaque key-value service shared by every instance of
 * the deployment. It stores key records, the active key id and a named lock
 * used to serialize rotations.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Lock acquisition MUST be atomic (one winner per lock name)</li>
 *   <li>Locks MUST expire after their lease so a crashed holder cannot
 *       block rotation forever</li>
 *   <li>{@link #releaseLock} MUST only release a lock still held by the
 *       given owner token</li>
 *   <li>Deleting an unknown key MUST succeed</li>
 *   <li>{@link #deactivateKey} MUST check and write atomically</li>
 *   <li>Private keys should never be logged</li>
 * </ul>
 *
 * @see keyring.adapter.out.storage.redis.RedisKeyMetadataStore
 * @see keyring.adapter.out.storage.memory.InMemoryRemoteKeyMetadataStore
 */
public interface RemoteKeyMetadataStore {

    /**
     * Short name for logging and timeout reporting.
     */
    String name();

    /**
     * Get a key record by id.
     *
     * @param keyId the key identifier
     * @return Uni with the key if found, empty otherwise
     */
    Uni<Optional<SigningKey>> getKey(String keyId);

    /**
     * Store or overwrite a key record and add its id to the key listing.
     *
     * @param key the key record
     * @return Uni completing when stored
     */
    Uni<Void> saveKey(SigningKey key);

    /**
     * Overwrite a stored key record with its inactive form, but only while
     * the record still exists. Never adds the id to the key listing, so a key
     * deleted concurrently stays deleted.
     *
     * @param key the key record to deactivate
     * @return Uni with true if the record was updated, false if it was gone
     */
    Uni<Boolean> deactivateKey(SigningKey key);

    /**
     * Get the id of the active key.
     *
     * @return Uni with the active id, empty if none was ever published
     */
    Uni<Optional<String>> getActiveKeyId();

    /**
     * Point the active key id at the given key.
     *
     * @param keyId the key identifier
     * @return Uni completing when stored
     */
    Uni<Void> setActiveKeyId(String keyId);

    /**
     * List the ids of every stored key.
     *
     * @return Uni with all key ids (may be empty)
     */
    Uni<List<String>> listKeyIds();

    /**
     * Delete a key record and remove it from the key listing.
     *
     * @param keyId the key identifier
     * @return Uni completing when deleted (also when the key was absent)
     */
    Uni<Void> deleteKey(String keyId);

    /**
     * Try once to acquire a named lock.
     *
     * @param lockName the lock name
     * @param lease    how long the lock is held before it expires on its own
     * @return Uni with an owner token if acquired, empty if someone else holds it
     */
    Uni<Optional<String>> tryAcquireLock(String lockName, Duration lease);

    /**
     * Release a lock if it is still held by the given owner.
     *
     * @param lockName   the lock name
     * @param ownerToken token returned by {@link #tryAcquireLock}
     * @return Uni completing when released
     */
    Uni<Void> releaseLock(String lockName, String ownerToken);
}
