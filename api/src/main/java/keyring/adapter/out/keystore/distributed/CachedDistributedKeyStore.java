package keyring.adapter.out.keystore.distributed;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyring.adapter.out.storage.BackendTimeoutHelper;
import keyring.core.cache.KeyStoreCache;
import keyring.core.config.KeyStoreConfig;
import keyring.core.model.auth.SigningKey;
import keyring.core.service.auth.SigningKeyGenerator;
import keyring.spi.KeyStore;
import keyring.spi.NoActiveKeyException;
import keyring.spi.RemoteKeyMetadataStore;
import keyring.spi.RotationInProgressException;

/**
 * Key store shared by every instance of a deployment through a
 * {@link RemoteKeyMetadataStore}, with a process-local cache in front.
 *
 * <h2>Reads</h2>
 * Cache hits never touch the backend. Misses load from the backend and
 * populate the cache. Data changed by another instance becomes visible here
 * once the local entries expire.
 *
 * <h2>Rotation</h2>
 * Serialized across instances by a named lock with a lease. The active key
 * id is read from the backend (never from the cache) while holding the lock,
 * the previous key is marked inactive (only if it was not retired in the
 * meantime), the new key is stored and the active pointer moves to it. The
 * lock is released on success and on failure.
 *
 * <p>The lock lease must outlast the slowest possible rotation, that is
 * every remote call under the lock hitting its timeout, plus time for key
 * generation. Shorter leases are rejected at construction.
 *
 * <h2>Failure handling</h2>
 * Every backend call is bounded by a timeout. When loading the key list
 * fails, a recent last-known-good list is served instead so verification
 * survives short backend outages.
 */
public class CachedDistributedKeyStore implements KeyStore {

    private static final Logger LOG = Logger.getLogger(CachedDistributedKeyStore.class);

    // getActiveKeyId, getKey, deactivateKey, saveKey, setActiveKeyId
    static final int REMOTE_CALLS_PER_ROTATION = 5;
    static final Duration KEY_GENERATION_ALLOWANCE = Duration.ofSeconds(5);

    private final RemoteKeyMetadataStore remote;
    private final KeyStoreCache cache;
    private final SigningKeyGenerator generator;
    private final BackendTimeoutHelper timeouts;
    private final RotationLock lock;

    /**
     * Settings of the rotation lock.
     *
     * @param name          lock name in the backend
     * @param lease         how long a holder keeps the lock at most
     * @param maxWait       how long rotation waits to acquire the lock
     * @param retryInterval pause between acquisition attempts
     */
    public record RotationLock(String name, Duration lease, Duration maxWait, Duration retryInterval) {

        public static RotationLock from(KeyStoreConfig.DistributedConfig config) {
            return new RotationLock(
                    config.lockName(), config.lockLease(), config.lockWait(), config.lockRetryInterval());
        }

        long retries() {
            if (retryInterval.isZero() || retryInterval.isNegative()) {
                return 0;
            }
            return maxWait.toMillis() / retryInterval.toMillis();
        }
    }

    public CachedDistributedKeyStore(
            RemoteKeyMetadataStore remote,
            KeyStoreCache cache,
            SigningKeyGenerator generator,
            Duration remoteTimeout,
            RotationLock lock) {
        final var minimumLease = minimumLease(remoteTimeout);
        if (lock.lease().compareTo(minimumLease) < 0) {
            throw new IllegalArgumentException("Rotation lock lease " + lock.lease()
                    + " is shorter than a worst-case rotation (" + minimumLease + " with remote timeout "
                    + remoteTimeout + ")");
        }
        this.remote = remote;
        this.cache = cache;
        this.generator = generator;
        this.timeouts = new BackendTimeoutHelper(remoteTimeout, remote.name());
        this.lock = lock;
    }

    /**
     * Shortest lock lease that covers a rotation whose remote calls all time out.
     */
    public static Duration minimumLease(Duration remoteTimeout) {
        return remoteTimeout.multipliedBy(REMOTE_CALLS_PER_ROTATION).plus(KEY_GENERATION_ALLOWANCE);
    }

    @Override
    public String name() {
        return "distributed(" + remote.name() + ")";
    }

    @Override
    public Uni<SigningKey> getActiveKey() {
        return activeKeyId()
                .flatMap(id -> key(id).map(key -> key.orElseThrow(
                        () -> new NoActiveKeyException("Active signing key " + id + " not found in " + remote.name()))));
    }

    private Uni<String> activeKeyId() {
        final var cached = cache.activeKeyId();
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached.get());
        }
        final var generation = cache.generation();
        return timeouts.withTimeout(remote.getActiveKeyId(), "getActiveKeyId").map(id -> {
            final var activeId = id.orElseThrow(
                    () -> new NoActiveKeyException("No active signing key published in " + remote.name()));
            cache.putActiveKeyId(activeId, generation);
            return activeId;
        });
    }

    private Uni<Optional<SigningKey>> key(String keyId) {
        final var cached = cache.key(keyId);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached);
        }
        return fetchKey(keyId);
    }

    private Uni<Optional<SigningKey>> fetchKey(String keyId) {
        final var generation = cache.generation();
        return timeouts.withTimeout(remote.getKey(keyId), "getKey")
                .invoke(key -> key.ifPresent(k -> cache.putKey(k, generation)));
    }

    @Override
    public Uni<List<SigningKey>> getAllKeys() {
        final var cached = cache.allKeys();
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached.get());
        }
        final var generation = cache.generation();
        return loadAllKeys().invoke(keys -> cache.putAllKeys(keys, generation)).onFailure().recoverWithUni(error -> {
            final var stale = cache.lastKnownGood();
            if (stale.isEmpty()) {
                return Uni.createFrom().failure(error);
            }
            LOG.warnv(
                    "Serving last-known-good key list from {0} after failure: {1}", remote.name(), error.getMessage());
            return Uni.createFrom().item(stale.get());
        });
    }

    private Uni<List<SigningKey>> loadAllKeys() {
        // Records are read from the backend so active flags match the listing
        return timeouts.withTimeout(remote.listKeyIds(), "listKeyIds").flatMap(ids -> {
            if (ids.isEmpty()) {
                return Uni.createFrom().item(List.<SigningKey>of());
            }
            final List<Uni<Optional<SigningKey>>> loads =
                    ids.stream().map(this::fetchKey).toList();
            return Uni.join().all(loads).andFailFast().map(keys -> keys.stream()
                    .flatMap(Optional::stream)
                    .toList());
        });
    }

    @Override
    public Uni<SigningKey> createAndActivateNewKey() {
        return withRotationLock(this::rotateUnderLock);
    }

    private Uni<SigningKey> rotateUnderLock() {
        return timeouts.withTimeout(remote.getActiveKeyId(), "getActiveKeyId").flatMap(previousId -> {
            final var newKey = generator.generate();
            return deactivate(previousId)
                    .flatMap(v -> timeouts.withTimeout(remote.saveKey(newKey), "saveKey"))
                    .flatMap(v -> timeouts.withTimeout(remote.setActiveKeyId(newKey.keyId()), "setActiveKeyId"))
                    .invoke(() -> {
                        cache.invalidateKey(previousId.orElse(null));
                        LOG.infov(
                                "Rotated signing key in {0}: {1} -> {2}",
                                remote.name(), previousId.orElse("none"), newKey.keyId());
                    })
                    .replaceWith(newKey);
        });
    }

    private Uni<Void> deactivate(Optional<String> keyId) {
        if (keyId.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        return timeouts.withTimeout(remote.getKey(keyId.get()), "getKey").flatMap(previous -> previous
                .map(key -> timeouts.withTimeout(remote.deactivateKey(key), "deactivateKey")
                        .invoke(updated -> {
                            if (!updated) {
                                LOG.infov(
                                        "Previous key {0} was retired during rotation; not restoring it",
                                        key.keyId());
                            }
                        })
                        .replaceWithVoid())
                .orElseGet(() -> Uni.createFrom().voidItem()));
    }

    @Override
    public Uni<Void> retireKey(String keyId) {
        return timeouts.withTimeout(remote.deleteKey(keyId), "deleteKey").invoke(() -> {
            cache.invalidateKey(keyId);
            LOG.infov("Retired signing key {0} in {1}", keyId, remote.name());
        });
    }

    /**
     * Publish an initial key when the backend has no active key id.
     *
     * <p>The check is repeated under the rotation lock. An instance that cannot
     * get the lock assumes the holder is publishing and carries on.
     */
    @Override
    public Uni<Void> initialize() {
        return timeouts.withTimeout(remote.getActiveKeyId(), "getActiveKeyId").flatMap(activeId -> {
            if (activeId.isPresent()) {
                LOG.debugv("Key store {0} already has active key {1}", remote.name(), activeId.get());
                return Uni.createFrom().voidItem();
            }
            return withRotationLock(this::publishInitialKeyIfMissing)
                    .onFailure(RotationInProgressException.class)
                    .recoverWithItem(() -> {
                        LOG.infov("Another instance holds lock {0}; skipping initial key publication", lock.name());
                        return null;
                    });
        });
    }

    private Uni<Void> publishInitialKeyIfMissing() {
        return timeouts.withTimeout(remote.getActiveKeyId(), "getActiveKeyId").flatMap(activeId -> {
            if (activeId.isPresent()) {
                return Uni.createFrom().voidItem();
            }
            final var initial = generator.generate();
            return timeouts.withTimeout(remote.saveKey(initial), "saveKey")
                    .flatMap(v -> timeouts.withTimeout(remote.setActiveKeyId(initial.keyId()), "setActiveKeyId"))
                    .invoke(() -> {
                        cache.invalidateAll();
                        LOG.infov("Published initial signing key {0} to {1}", initial.keyId(), remote.name());
                    });
        });
    }

    private <T> Uni<T> withRotationLock(Supplier<Uni<T>> action) {
        return acquireLock()
                .flatMap(ownerToken -> Uni.createFrom()
                        .deferred(() -> action.get())
                        .eventually(() -> timeouts.withTimeoutSilent(
                                remote.releaseLock(lock.name(), ownerToken), "releaseLock")));
    }

    private Uni<String> acquireLock() {
        final Uni<String> attempt = Uni.createFrom()
                .deferred(() -> timeouts.withTimeout(remote.tryAcquireLock(lock.name(), lock.lease()), "tryAcquireLock"))
                .map(ownerToken -> ownerToken.orElseThrow(() -> new RotationInProgressException(
                        "Rotation lock " + lock.name() + " is held by another instance")));

        final var retries = lock.retries();
        if (retries <= 0) {
            return attempt;
        }
        return attempt.onFailure(RotationInProgressException.class)
                .retry()
                .withBackOff(lock.retryInterval(), lock.retryInterval())
                .atMost(retries)
                .onFailure(e -> !(e instanceof RotationInProgressException)
                        && e.getCause() instanceof RotationInProgressException)
                .transform(e -> new RotationInProgressException(
                        "Rotation lock " + lock.name() + " not acquired within " + lock.maxWait()));
    }
}
