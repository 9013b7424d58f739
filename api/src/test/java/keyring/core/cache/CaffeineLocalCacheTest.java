package keyring.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CaffeineLocalCache")
class CaffeineLocalCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Nested
    @DisplayName("Basic Operations")
    class BasicOperations {

        private CaffeineLocalCache<String, String> cache;

        @BeforeEach
        void setUp() {
            cache = new CaffeineLocalCache<>(Duration.ofMinutes(5), Duration.ZERO, 100, 0.0, ticker);
        }

        @Test
        @DisplayName("should put and get a value")
        void shouldPutAndGetValue() {
            cache.put("key1", "value1");

            var result = cache.get("key1");
            assertTrue(result.isPresent());
            assertEquals("value1", result.get());
        }

        @Test
        @DisplayName("should return empty for missing key")
        void shouldReturnEmptyForMissingKey() {
            assertFalse(cache.get("missing").isPresent());
        }

        @Test
        @DisplayName("should invalidate a specific key")
        void shouldInvalidateSpecificKey() {
            cache.put("key1", "value1");
            cache.put("key2", "value2");

            cache.invalidate("key1");

            assertFalse(cache.get("key1").isPresent());
            assertTrue(cache.get("key2").isPresent());
        }

        @Test
        @DisplayName("should invalidate all keys")
        void shouldInvalidateAllKeys() {
            cache.put("key1", "value1");
            cache.put("key2", "value2");

            cache.invalidateAll();

            assertFalse(cache.get("key1").isPresent());
            assertFalse(cache.get("key2").isPresent());
            assertEquals(0, cache.estimatedSize());
        }

        @Test
        @DisplayName("should report estimated size")
        void shouldReportEstimatedSize() {
            cache.put("key1", "value1");
            cache.put("key2", "value2");

            assertEquals(2, cache.estimatedSize());
        }
    }

    @Nested
    @DisplayName("Absolute TTL")
    class AbsoluteTtl {

        @Test
        @DisplayName("should expire entries after TTL")
        void shouldExpireEntriesAfterTtl() {
            var cache = new CaffeineLocalCache<String, String>(Duration.ofMinutes(5), Duration.ZERO, 100, 0.0, ticker);
            cache.put("key1", "value1");

            advance(Duration.ofMinutes(4));
            assertTrue(cache.get("key1").isPresent());

            advance(Duration.ofMinutes(2));
            assertFalse(cache.get("key1").isPresent());
        }

        @Test
        @DisplayName("reads should not extend an entry past its TTL")
        void readsShouldNotExtendPastTtl() {
            var cache = new CaffeineLocalCache<String, String>(
                    Duration.ofMinutes(5), Duration.ofMinutes(1), 100, 0.0, ticker);
            cache.put("key1", "value1");

            // Read every 50 seconds so the sliding window never lapses
            for (int i = 0; i < 5; i++) {
                advance(Duration.ofSeconds(50));
                assertTrue(cache.get("key1").isPresent(), "read " + i);
            }

            advance(Duration.ofSeconds(51));
            assertFalse(cache.get("key1").isPresent());
        }
    }

    @Nested
    @DisplayName("Sliding Window")
    class SlidingWindow {

        @Test
        @DisplayName("should expire entries that are not read within the window")
        void shouldExpireIdleEntries() {
            var cache = new CaffeineLocalCache<String, String>(
                    Duration.ofMinutes(5), Duration.ofMinutes(1), 100, 0.0, ticker);
            cache.put("key1", "value1");

            advance(Duration.ofSeconds(61));

            assertFalse(cache.get("key1").isPresent());
        }

        @Test
        @DisplayName("a read should restart the window")
        void readShouldRestartWindow() {
            var cache = new CaffeineLocalCache<String, String>(
                    Duration.ofMinutes(5), Duration.ofMinutes(1), 100, 0.0, ticker);
            cache.put("key1", "value1");

            advance(Duration.ofSeconds(45));
            assertTrue(cache.get("key1").isPresent());

            advance(Duration.ofSeconds(45));
            assertTrue(cache.get("key1").isPresent());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject a zero TTL")
        void shouldRejectZeroTtl() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new CaffeineLocalCache<String, String>(Duration.ZERO, Duration.ZERO, 100, 0.0, ticker));
        }

        @Test
        @DisplayName("should reject jitter factor above 0.5")
        void shouldRejectJitterAboveHalf() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new CaffeineLocalCache<String, String>(Duration.ofMinutes(1), Duration.ZERO, 100, 0.6));
        }

        @Test
        @DisplayName("jitter should keep entries within the jittered TTL")
        void jitterShouldStayWithinBounds() {
            var cache = new CaffeineLocalCache<String, String>(Duration.ofMinutes(10), Duration.ZERO, 100, 0.1, ticker);
            for (int i = 0; i < 20; i++) {
                cache.put("key" + i, "value");
            }

            advance(Duration.ofMinutes(8).plusSeconds(59));
            for (int i = 0; i < 20; i++) {
                assertTrue(cache.get("key" + i).isPresent());
            }

            advance(Duration.ofMinutes(2).plusSeconds(2));
            for (int i = 0; i < 20; i++) {
                assertFalse(cache.get("key" + i).isPresent());
            }
        }
    }
}
