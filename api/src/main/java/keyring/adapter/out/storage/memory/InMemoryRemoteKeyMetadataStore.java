package keyring.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;

import keyring.core.model.auth.SigningKey;
import keyring.spi.RemoteKeyMetadataStore;

/**
 * In-memory implementation of {@link RemoteKeyMetadataStore}.
 *
 * <p>Shared state only within one JVM. Used for development and for tests
 * that run several key store instances against one backend.
 */
public class InMemoryRemoteKeyMetadataStore implements RemoteKeyMetadataStore {

    private final ConcurrentHashMap<String, SigningKey> keys = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Lease> locks = new ConcurrentHashMap<>();
    private final AtomicReference<String> activeKeyId = new AtomicReference<>();
    private final Clock clock;

    private record Lease(String ownerToken, Instant expiresAt) {}

    public InMemoryRemoteKeyMetadataStore() {
        this(Clock.systemUTC());
    }

    public InMemoryRemoteKeyMetadataStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Uni<Optional<SigningKey>> getKey(String keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(keys.get(keyId)));
    }

    @Override
    public Uni<Void> saveKey(SigningKey key) {
        return Uni.createFrom().item(() -> {
            keys.put(key.keyId(), key);
            return null;
        });
    }

    @Override
    public Uni<Boolean> deactivateKey(SigningKey key) {
        return Uni.createFrom().item(
                () -> keys.computeIfPresent(key.keyId(), (id, current) -> current.deactivate()) != null);
    }

    @Override
    public Uni<Optional<String>> getActiveKeyId() {
        return Uni.createFrom().item(() -> Optional.ofNullable(activeKeyId.get()));
    }

    @Override
    public Uni<Void> setActiveKeyId(String keyId) {
        return Uni.createFrom().item(() -> {
            activeKeyId.set(keyId);
            return null;
        });
    }

    @Override
    public Uni<List<String>> listKeyIds() {
        return Uni.createFrom().item(() -> List.copyOf(keys.keySet()));
    }

    @Override
    public Uni<Void> deleteKey(String keyId) {
        return Uni.createFrom().item(() -> {
            keys.remove(keyId);
            return null;
        });
    }

    @Override
    public Uni<Optional<String>> tryAcquireLock(String lockName, Duration lease) {
        return Uni.createFrom().item(() -> {
            final var ownerToken = UUID.randomUUID().toString();
            final var now = clock.instant();
            final var granted = locks.compute(lockName, (name, current) -> {
                if (current == null || !current.expiresAt().isAfter(now)) {
                    return new Lease(ownerToken, now.plus(lease));
                }
                return current;
            });
            return granted.ownerToken().equals(ownerToken) ? Optional.of(ownerToken) : Optional.<String>empty();
        });
    }

    @Override
    public Uni<Void> releaseLock(String lockName, String ownerToken) {
        return Uni.createFrom().item(() -> {
            locks.computeIfPresent(
                    lockName, (name, current) -> current.ownerToken().equals(ownerToken) ? null : current);
            return null;
        });
    }
}
