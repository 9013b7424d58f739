package keyring.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Caffeine-backed local cache with an absolute TTL, a sliding idle window and
 * optional TTL jitter.
 *
 * <p>
 * An entry expires when either limit is hit first:
 * <ul>
 * <li>the absolute TTL measured from the write, which bounds staleness</li>
 * <li>the sliding window measured from the last read, which drops entries
 * nobody asks for any more</li>
 * </ul>
 * Reads never extend an entry past its absolute TTL.
 *
 * <p>
 * <b>TTL Jitter:</b> To prevent cache refresh storms in multi-instance deployments,
 * each entry's TTL can be varied by a jitter factor. Jitter stretches the
 * staleness bound by the same factor, so it is off unless configured.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, Entry<V>> cache;
    private final Ticker ticker;
    private final long baseTtlNanos;
    private final long slidingWindowNanos;
    private final double jitterFactor;

    private record Entry<V>(V value, long writtenAtNanos, long ttlNanos) {}

    /**
     * Create a new cache using the system ticker.
     *
     * @param ttl           the absolute time-to-live for cache entries
     * @param slidingWindow idle time after which an unread entry expires
     *                      (zero or null to disable)
     * @param maxSize       the maximum number of entries in the cache
     * @param jitterFactor  the jitter factor (0.0 to 0.5); 0 disables jitter
     */
    public CaffeineLocalCache(Duration ttl, Duration slidingWindow, long maxSize, double jitterFactor) {
        this(ttl, slidingWindow, maxSize, jitterFactor, Ticker.systemTicker());
    }

    /**
     * Create a new cache with an explicit time source.
     *
     * @param ttl           the absolute time-to-live for cache entries
     * @param slidingWindow idle time after which an unread entry expires
     *                      (zero or null to disable)
     * @param maxSize       the maximum number of entries in the cache
     * @param jitterFactor  the jitter factor (0.0 to 0.5); 0 disables jitter
     * @param ticker        time source for expiration
     */
    public CaffeineLocalCache(Duration ttl, Duration slidingWindow, long maxSize, double jitterFactor, Ticker ticker) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        if (jitterFactor < 0.0 || jitterFactor > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }
        this.ticker = ticker;
        this.baseTtlNanos = ttl.toNanos();
        this.slidingWindowNanos =
                slidingWindow == null || slidingWindow.isNegative() || slidingWindow.isZero()
                        ? Long.MAX_VALUE
                        : slidingWindow.toNanos();
        this.jitterFactor = jitterFactor;

        this.cache = Caffeine.newBuilder()
                .expireAfter(new AbsoluteAndSlidingExpiry())
                .maximumSize(maxSize)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Expiry policy combining the absolute TTL with the sliding window.
     */
    private class AbsoluteAndSlidingExpiry implements Expiry<K, Entry<V>> {
        @Override
        public long expireAfterCreate(K key, Entry<V> entry, long currentTime) {
            return Math.min(entry.ttlNanos(), slidingWindowNanos);
        }

        @Override
        public long expireAfterUpdate(K key, Entry<V> entry, long currentTime, long currentDuration) {
            return Math.min(entry.ttlNanos(), slidingWindowNanos);
        }

        @Override
        public long expireAfterRead(K key, Entry<V> entry, long currentTime, long currentDuration) {
            final var remaining = entry.writtenAtNanos() + entry.ttlNanos() - currentTime;
            return Math.max(0, Math.min(remaining, slidingWindowNanos));
        }
    }

    private long applyJitter(long baseTtl) {
        if (jitterFactor == 0.0) {
            return baseTtl;
        }
        // Multiply by random value in [1-jitterFactor, 1+jitterFactor]
        final var jitter = ThreadLocalRandom.current().nextDouble() * 2 * jitterFactor;
        final var jitterMultiplier = 1.0 - jitterFactor + jitter;
        return (long) (baseTtl * jitterMultiplier);
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(Entry::value);
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, new Entry<>(value, ticker.read(), applyJitter(baseTtlNanos)));
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
