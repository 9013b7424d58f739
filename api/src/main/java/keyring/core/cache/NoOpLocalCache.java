package keyring.core.cache;

import java.util.Optional;

/**
 * Cache that never stores anything. Used when the cache TTL is zero.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class NoOpLocalCache<K, V> implements LocalCache<K, V> {

    @Override
    public Optional<V> get(K key) {
        return Optional.empty();
    }

    @Override
    public void put(K key, V value) {
        // Nothing cached
    }

    @Override
    public void invalidate(K key) {
        // Nothing cached
    }

    @Override
    public void invalidateAll() {
        // Nothing cached
    }

    @Override
    public long estimatedSize() {
        return 0;
    }
}
