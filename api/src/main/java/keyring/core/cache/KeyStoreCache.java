package keyring.core.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import com.github.benmanes.caffeine.cache.Ticker;

import keyring.core.config.KeyStoreConfig;
import keyring.core.model.auth.SigningKey;

/**
 * Process-local cache in front of a remote key store.
 *
 * <p>Holds three kinds of entries: single keys by id, the full key list and
 * the active key id. All of them share the same TTL and sliding window.
 *
 * <p>Independently of the TTL cache, the last key list loaded from the
 * backend is remembered as a last-known-good snapshot. Verification may fall
 * back to it for {@code staleIfError} when the backend fails. Local rotation
 * or retirement drops the snapshot, since it no longer describes the store.
 *
 * <p>Every invalidation bumps a generation counter. Loaders read
 * {@link #generation()} before they go to the backend and hand it to the
 * {@code put} methods, which drop the result if an invalidation happened in
 * between. A load that raced a local rotation or retirement therefore never
 * repopulates the cache with the state it replaced.
 */
public class KeyStoreCache {

    private static final String ALL_KEYS = "all";
    private static final String ACTIVE_ID = "active";

    private final LocalCache<String, SigningKey> keys;
    private final LocalCache<String, List<SigningKey>> allKeys;
    private final LocalCache<String, String> activeKeyId;
    private final long staleIfErrorNanos;
    private final Ticker ticker;
    private final AtomicLong generation = new AtomicLong();

    private volatile Snapshot lastKnownGood;

    private record Snapshot(List<SigningKey> keys, long fetchedAtNanos) {}

    KeyStoreCache(
            LocalCache<String, SigningKey> keys,
            LocalCache<String, List<SigningKey>> allKeys,
            LocalCache<String, String> activeKeyId,
            Duration staleIfError,
            Ticker ticker) {
        this.keys = keys;
        this.allKeys = allKeys;
        this.activeKeyId = activeKeyId;
        this.staleIfErrorNanos = staleIfError == null || staleIfError.isNegative() ? 0 : staleIfError.toNanos();
        this.ticker = ticker;
    }

    public static KeyStoreCache create(KeyStoreConfig.CacheConfig config) {
        return create(
                config.ttl(),
                config.slidingWindow(),
                config.maxEntries(),
                config.jitterFactor(),
                config.staleIfError(),
                Ticker.systemTicker());
    }

    /**
     * Build a cache. A zero TTL yields a cache that never stores anything.
     */
    public static KeyStoreCache create(
            Duration ttl,
            Duration slidingWindow,
            long maxEntries,
            double jitterFactor,
            Duration staleIfError,
            Ticker ticker) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return new KeyStoreCache(
                    new NoOpLocalCache<>(), new NoOpLocalCache<>(), new NoOpLocalCache<>(), staleIfError, ticker);
        }
        return new KeyStoreCache(
                new CaffeineLocalCache<>(ttl, slidingWindow, maxEntries, jitterFactor, ticker),
                new CaffeineLocalCache<>(ttl, slidingWindow, 1, jitterFactor, ticker),
                new CaffeineLocalCache<>(ttl, slidingWindow, 1, jitterFactor, ticker),
                staleIfError,
                ticker);
    }

    /**
     * Current invalidation generation. Capture it before loading from the
     * backend and pass it to the matching {@code put} call.
     */
    public long generation() {
        return generation.get();
    }

    public Optional<SigningKey> key(String keyId) {
        return keys.get(keyId);
    }

    public void putKey(SigningKey key, long loadedAt) {
        if (!isCurrent(loadedAt)) {
            return;
        }
        keys.put(key.keyId(), key);
        if (!isCurrent(loadedAt)) {
            keys.invalidate(key.keyId());
        }
    }

    public Optional<List<SigningKey>> allKeys() {
        return allKeys.get(ALL_KEYS);
    }

    /**
     * Cache the full key list and remember it as last-known-good.
     */
    public void putAllKeys(List<SigningKey> list, long loadedAt) {
        if (!isCurrent(loadedAt)) {
            return;
        }
        final var copy = List.copyOf(list);
        allKeys.put(ALL_KEYS, copy);
        lastKnownGood = new Snapshot(copy, ticker.read());
        if (!isCurrent(loadedAt)) {
            allKeys.invalidate(ALL_KEYS);
            lastKnownGood = null;
        }
    }

    public Optional<String> activeKeyId() {
        return activeKeyId.get(ACTIVE_ID);
    }

    public void putActiveKeyId(String keyId, long loadedAt) {
        if (!isCurrent(loadedAt)) {
            return;
        }
        activeKeyId.put(ACTIVE_ID, keyId);
        if (!isCurrent(loadedAt)) {
            activeKeyId.invalidate(ACTIVE_ID);
        }
    }

    /**
     * The last key list loaded from the backend, if it is recent enough to
     * serve while the backend is failing.
     */
    public Optional<List<SigningKey>> lastKnownGood() {
        final var snapshot = lastKnownGood;
        if (snapshot == null || staleIfErrorNanos == 0) {
            return Optional.empty();
        }
        if (ticker.read() - snapshot.fetchedAtNanos() > staleIfErrorNanos) {
            return Optional.empty();
        }
        return Optional.of(snapshot.keys());
    }

    /**
     * Drop everything derived from the given key plus the aggregates.
     */
    public void invalidateKey(String keyId) {
        generation.incrementAndGet();
        if (keyId != null) {
            keys.invalidate(keyId);
        }
        invalidateAggregates();
    }

    /**
     * Drop the key list, the active id and the last-known-good snapshot.
     */
    public void invalidateAggregates() {
        generation.incrementAndGet();
        allKeys.invalidate(ALL_KEYS);
        activeKeyId.invalidate(ACTIVE_ID);
        lastKnownGood = null;
    }

    public void invalidateAll() {
        generation.incrementAndGet();
        keys.invalidateAll();
        invalidateAggregates();
    }

    // The generation is bumped before entries are dropped, so a put that
    // passes the first check but lands after the drop is undone by the second.
    private boolean isCurrent(long loadedAt) {
        return generation.get() == loadedAt;
    }
}
