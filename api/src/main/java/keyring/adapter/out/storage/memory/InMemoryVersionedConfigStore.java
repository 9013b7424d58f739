package keyring.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Uni;

import keyring.spi.VersionConflictException;
import keyring.spi.VersionedConfigStore;
import keyring.spi.VersionedValue;

/**
 * In-memory implementation of {@link VersionedConfigStore}.
 *
 * <p>Versions come from one counter, so they never repeat.
 */
public class InMemoryVersionedConfigStore implements VersionedConfigStore {

    private final ConcurrentHashMap<String, VersionedValue> settings = new ConcurrentHashMap<>();
    private final AtomicLong versions = new AtomicLong();

    @Override
    public String name() {
        return "memory-config";
    }

    @Override
    public Uni<Optional<VersionedValue>> get(String key) {
        return Uni.createFrom().item(() -> Optional.ofNullable(settings.get(key)));
    }

    @Override
    public Uni<VersionedValue> set(String key, String value) {
        return Uni.createFrom().item(() -> {
            final var written = new VersionedValue(value, nextVersion());
            settings.put(key, written);
            return written;
        });
    }

    @Override
    public Uni<VersionedValue> setIfVersion(String key, String value, Optional<String> expectedVersion) {
        return Uni.createFrom().item(() -> settings.compute(key, (k, current) -> {
            final var currentVersion = Optional.ofNullable(current).map(VersionedValue::version);
            if (!currentVersion.equals(expectedVersion)) {
                throw new VersionConflictException(key);
            }
            return new VersionedValue(value, nextVersion());
        }));
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            settings.remove(key);
            return null;
        });
    }

    private String nextVersion() {
        return Long.toString(versions.incrementAndGet());
    }
}
