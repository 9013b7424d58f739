package keyring.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import keyring.TestKeys;
import keyring.spi.KeyStoreException;

@DisplayName("RedisKeyMetadataStore")
@ExtendWith(MockitoExtension.class)
class RedisKeyMetadataStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String PREFIX = "keyring:";

    @Mock
    private ReactiveRedisDataSource redisDataSource;

    @Mock
    private ReactiveValueCommands<String, String> valueCommands;

    @Mock
    private ReactiveSetCommands<String, String> setCommands;

    @Mock
    private ReactiveKeyCommands<String> keyCommands;

    private RedisKeyMetadataStore store;

    @BeforeEach
    void setUp() {
        when(redisDataSource.value(String.class, String.class)).thenReturn(valueCommands);
        when(redisDataSource.set(String.class, String.class)).thenReturn(setCommands);
        when(redisDataSource.key(String.class)).thenReturn(keyCommands);
        store = new RedisKeyMetadataStore(redisDataSource, PREFIX);
    }

    @Nested
    @DisplayName("Serialization")
    class Serialization {

        @Test
        @DisplayName("should store the private key as base64 PKCS8 without PEM armour")
        void shouldStoreBase64PrivateKey() {
            final var key = TestKeys.signingKey("k1", true);

            final var json = RedisKeyMetadataStore.serialize(key);

            assertTrue(json.contains("\"keyId\":\"k1\""));
            assertTrue(json.contains("\"createdAt\":\"2024-01-01T00:00:00Z\""));
            assertTrue(json.contains(key.privateKeyBase64()));
            assertFalse(json.contains("BEGIN PRIVATE KEY"));
        }

        @Test
        @DisplayName("should restore the key and derive its public key")
        void shouldRestoreKey() {
            final var key = TestKeys.signingKey("k1", false);

            final var restored = RedisKeyMetadataStore.deserialize(RedisKeyMetadataStore.serialize(key));

            assertEquals(key.keyId(), restored.keyId());
            assertEquals(key.createdAt(), restored.createdAt());
            assertFalse(restored.active());
            assertEquals(key.publicKey(), restored.publicKey());
        }

        @Test
        @DisplayName("should reject corrupt records")
        void shouldRejectCorruptRecords() {
            assertThrows(KeyStoreException.class, () -> RedisKeyMetadataStore.deserialize("{not json"));
        }
    }

    @Nested
    @DisplayName("Keys")
    class Keys {

        @Test
        @DisplayName("should return empty for an unknown key")
        void shouldReturnEmptyForUnknownKey() {
            when(valueCommands.get(PREFIX + "key:missing")).thenReturn(Uni.createFrom().nullItem());

            assertTrue(store.getKey("missing").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("saveKey should write the record and add the id to the listing")
        void saveKeyShouldWriteAndList() {
            final var key = TestKeys.signingKey("k1", true);
            when(valueCommands.set(eq(PREFIX + "key:k1"), anyString())).thenReturn(Uni.createFrom().voidItem());
            when(setCommands.sadd(PREFIX + "keys", "k1")).thenReturn(Uni.createFrom().item(1));

            store.saveKey(key).await().atMost(TIMEOUT);

            verify(valueCommands).set(PREFIX + "key:k1", RedisKeyMetadataStore.serialize(key));
            verify(setCommands).sadd(PREFIX + "keys", "k1");
        }

        @Test
        @DisplayName("deactivateKey should write the inactive record only if it still exists")
        void deactivateKeyShouldUseConditionalScript() {
            final var key = TestKeys.signingKey("k1", true);
            final var inactiveJson = RedisKeyMetadataStore.serialize(key.deactivate());
            final var response = mock(Response.class);
            when(response.toLong()).thenReturn(1L);
            when(redisDataSource.execute(
                            eq("EVAL"), scriptThat("EXISTS"), eq("1"), eq(PREFIX + "key:k1"), eq(inactiveJson)))
                    .thenReturn(Uni.createFrom().item(response));

            assertTrue(store.deactivateKey(key).await().atMost(TIMEOUT));

            verify(setCommands, never()).sadd(PREFIX + "keys", "k1");
        }

        @Test
        @DisplayName("deactivateKey should report a record deleted in the meantime")
        void deactivateKeyShouldReportMissingRecord() {
            final var key = TestKeys.signingKey("k1", true);
            final var response = mock(Response.class);
            when(response.toLong()).thenReturn(0L);
            when(redisDataSource.execute(eq("EVAL"), anyString(), eq("1"), eq(PREFIX + "key:k1"), anyString()))
                    .thenReturn(Uni.createFrom().item(response));

            assertFalse(store.deactivateKey(key).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("deleteKey should remove the record and the listing entry")
        void deleteKeyShouldRemoveRecordAndListing() {
            when(keyCommands.del(PREFIX + "key:k1")).thenReturn(Uni.createFrom().item(1));
            when(setCommands.srem(PREFIX + "keys", "k1")).thenReturn(Uni.createFrom().item(1));

            store.deleteKey("k1").await().atMost(TIMEOUT);

            verify(setCommands).srem(PREFIX + "keys", "k1");
        }
    }

    @Nested
    @DisplayName("Locks")
    class Locks {

        @Test
        @DisplayName("should return an owner token when SET NX succeeds")
        void shouldReturnOwnerToken() {
            when(redisDataSource.execute(
                            eq("SET"), eq(PREFIX + "lock:rotation"), anyString(), eq("NX"), eq("PX"), eq("10000")))
                    .thenReturn(Uni.createFrom().item(mock(Response.class)));

            final var token = store.tryAcquireLock("rotation", Duration.ofSeconds(10))
                    .await()
                    .atMost(TIMEOUT);

            assertTrue(token.isPresent());
        }

        @Test
        @DisplayName("should return empty when the lock is held")
        void shouldReturnEmptyWhenHeld() {
            when(redisDataSource.execute(
                            eq("SET"), eq(PREFIX + "lock:rotation"), anyString(), eq("NX"), eq("PX"), eq("10000")))
                    .thenReturn(Uni.createFrom().nullItem());

            final var token = store.tryAcquireLock("rotation", Duration.ofSeconds(10))
                    .await()
                    .atMost(TIMEOUT);

            assertTrue(token.isEmpty());
        }

        @Test
        @DisplayName("release should pass the owner token to the compare-and-delete script")
        void releaseShouldUseOwnerToken() {
            final var response = mock(Response.class);
            when(response.toLong()).thenReturn(1L);
            when(redisDataSource.execute(
                            eq("EVAL"), anyString(), eq("1"), eq(PREFIX + "lock:rotation"), eq("owner-1")))
                    .thenReturn(Uni.createFrom().item(response));

            store.releaseLock("rotation", "owner-1").await().atMost(TIMEOUT);

            verify(redisDataSource)
                    .execute(eq("EVAL"), anyString(), eq("1"), eq(PREFIX + "lock:rotation"), eq("owner-1"));
        }
    }

    private static String scriptThat(String command) {
        return argThat(script -> script != null && script.contains(command));
    }
}
