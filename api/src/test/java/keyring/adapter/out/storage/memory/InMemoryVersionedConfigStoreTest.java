package keyring.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import keyring.spi.VersionConflictException;

@DisplayName("InMemoryVersionedConfigStore")
class InMemoryVersionedConfigStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryVersionedConfigStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryVersionedConfigStore();
    }

    @Test
    @DisplayName("every write should produce a new version")
    void everyWriteShouldProduceNewVersion() {
        final var first = store.set("key", "a").await().atMost(TIMEOUT);
        final var second = store.set("key", "a").await().atMost(TIMEOUT);

        assertNotEquals(first.version(), second.version());
        assertEquals(second, store.get("key").await().atMost(TIMEOUT).orElseThrow());
    }

    @Test
    @DisplayName("setIfVersion should write when the version matches")
    void setIfVersionShouldWriteOnMatch() {
        final var current = store.set("key", "a").await().atMost(TIMEOUT);

        final var written = store.setIfVersion("key", "b", Optional.of(current.version()))
                .await()
                .atMost(TIMEOUT);

        assertEquals("b", written.value());
        assertEquals("b", store.get("key").await().atMost(TIMEOUT).orElseThrow().value());
    }

    @Test
    @DisplayName("setIfVersion should fail when the version moved on")
    void setIfVersionShouldFailOnStaleVersion() {
        final var stale = store.set("key", "a").await().atMost(TIMEOUT);
        store.set("key", "b").await().atMost(TIMEOUT);

        assertThrows(
                VersionConflictException.class,
                () -> store.setIfVersion("key", "c", Optional.of(stale.version()))
                        .await()
                        .atMost(TIMEOUT));
        assertEquals("b", store.get("key").await().atMost(TIMEOUT).orElseThrow().value());
    }

    @Test
    @DisplayName("empty expected version should only create missing keys")
    void emptyExpectedVersionShouldOnlyCreate() {
        store.setIfVersion("key", "a", Optional.empty()).await().atMost(TIMEOUT);

        assertThrows(
                VersionConflictException.class,
                () -> store.setIfVersion("key", "b", Optional.empty()).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("a deleted key should not reuse an earlier version")
    void deletedKeyShouldNotReuseVersion() {
        final var first = store.set("key", "a").await().atMost(TIMEOUT);
        store.delete("key").await().atMost(TIMEOUT);
        assertTrue(store.get("key").await().atMost(TIMEOUT).isEmpty());

        final var recreated = store.setIfVersion("key", "a", Optional.empty()).await().atMost(TIMEOUT);

        assertNotEquals(first.version(), recreated.version());
    }
}
