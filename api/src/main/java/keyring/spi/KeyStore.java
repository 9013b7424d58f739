package keyring.spi;

import java.util.List;

import io.smallrye.mutiny.Uni;

import keyring.core.model.auth.SigningKey;

/**
 * Contract shared by every signing key store.
 *
 * <p>A store owns the set of signing keys plus a single "active key" pointer.
 * Token issuance signs with {@link #getActiveKey()}; verification looks keys
 * up by id in {@link #getAllKeys()}.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Exactly one key is active once {@link #createAndActivateNewKey()} completes</li>
 *   <li>Rotation never deletes keys; only {@link #retireKey(String)} does</li>
 *   <li>A retired key id is never handed out again</li>
 *   <li>Read paths never mutate store state</li>
 *   <li>Every wait on a remote backend is bounded</li>
 *   <li>All operations are non-blocking (return Uni)</li>
 * </ul>
 *
 * <h2>Consistency</h2>
 * Single-process stores reflect mutations immediately. Stores backed by a
 * shared backend may serve process-local cached data for up to the configured
 * cache TTL; a key retired on one instance can keep validating on another
 * instance for that long.
 *
 * @see keyring.adapter.out.keystore.memory.InMemoryKeyStore
 * @see keyring.adapter.out.keystore.distributed.CachedDistributedKeyStore
 * @see keyring.adapter.out.keystore.vault.VaultBackedKeyStore
 */
public interface KeyStore {

    /**
     * Short name for logging and diagnostics.
     */
    String name();

    /**
     * Get the key used to sign new tokens.
     *
     * @return Uni with the active key; fails with {@link NoActiveKeyException}
     *         if the store has none
     */
    Uni<SigningKey> getActiveKey();

    /**
     * Get every known key, active and inactive. Order is not significant.
     *
     * @return Uni with all keys (never empty after initialization)
     */
    Uni<List<SigningKey>> getAllKeys();

    /**
     * Generate a new key, make it the active key and deactivate the previous
     * one (which stays available for verification).
     *
     * @return Uni with the new active key; fails with
     *         {@link RotationInProgressException} or
     *         {@link RotationConflictException} under contention
     */
    Uni<SigningKey> createAndActivateNewKey();

    /**
     * Permanently remove a key. Tokens signed with it stop validating.
     *
     * <p>Retiring an unknown key id completes normally.
     *
     * @param keyId the key identifier
     * @return Uni completing when the key is gone
     */
    Uni<Void> retireKey(String keyId);

    /**
     * Publish an initial active key if the store has none.
     *
     * <p>Safe to call from several processes at once; at most one of them
     * publishes and the others observe its key.
     *
     * @return Uni completing once the store has an active key
     */
    default Uni<Void> initialize() {
        return Uni.createFrom().voidItem();
    }
}
