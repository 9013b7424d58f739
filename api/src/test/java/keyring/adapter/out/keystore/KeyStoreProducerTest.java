package keyring.adapter.out.keystore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.inject.Instance;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import keyring.adapter.out.keystore.distributed.CachedDistributedKeyStore;
import keyring.adapter.out.keystore.memory.InMemoryKeyStore;
import keyring.adapter.out.keystore.vault.VaultBackedKeyStore;
import keyring.core.config.KeyStoreConfig;

@DisplayName("KeyStoreProducer")
class KeyStoreProducerTest {

    private KeyStoreConfig config;
    private Instance<ReactiveRedisDataSource> redis;
    private Instance<Vertx> vertx;
    private KeyStoreProducer producer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        config = mock(KeyStoreConfig.class, RETURNS_DEEP_STUBS);
        redis = mock(Instance.class);
        vertx = mock(Instance.class);
        when(redis.isResolvable()).thenReturn(false);

        when(config.keySize()).thenReturn(2048);
        when(config.remoteTimeout()).thenReturn(Duration.ofSeconds(5));
        when(config.cache().ttl()).thenReturn(Duration.ofMinutes(5));
        when(config.cache().slidingWindow()).thenReturn(Duration.ofMinutes(1));
        when(config.cache().maxEntries()).thenReturn(100L);
        when(config.cache().jitterFactor()).thenReturn(0.0);
        when(config.cache().staleIfError()).thenReturn(Duration.ofMinutes(5));
        when(config.distributed().keyPrefix()).thenReturn("keyring:");
        when(config.distributed().lockName()).thenReturn("key-rotation");
        when(config.distributed().lockLease()).thenReturn(Duration.ofSeconds(30));
        when(config.distributed().lockWait()).thenReturn(Duration.ofSeconds(10));
        when(config.distributed().lockRetryInterval()).thenReturn(Duration.ofMillis(100));
        when(config.vault().secretPrefix()).thenReturn("jwt-signing-key-");
        when(config.vault().configPrefix()).thenReturn("keyring:config:");
        when(config.vault().maxRotationAttempts()).thenReturn(3);
        when(config.vault().rotationBackoff()).thenReturn(Duration.ofMillis(100));

        producer = new KeyStoreProducer(config, redis, vertx);
    }

    @Test
    @DisplayName("memory type should produce the in-memory store")
    void memoryTypeShouldProduceInMemoryStore() {
        when(config.type()).thenReturn("memory");

        assertInstanceOf(InMemoryKeyStore.class, producer.keyStore());
    }

    @Test
    @DisplayName("distributed type with memory backend should produce the cached store")
    void distributedTypeShouldProduceCachedStore() {
        when(config.type()).thenReturn("distributed");
        when(config.distributed().backend()).thenReturn("memory");

        final var store = producer.keyStore();

        assertInstanceOf(CachedDistributedKeyStore.class, store);
        assertEquals("distributed(memory)", store.name());
    }

    @Test
    @DisplayName("vault type with memory backends should produce the vault-backed store")
    void vaultTypeShouldProduceVaultStore() {
        when(config.type()).thenReturn("vault");
        when(config.vault().secretBackend()).thenReturn("memory");
        when(config.vault().configBackend()).thenReturn("memory");

        assertInstanceOf(VaultBackedKeyStore.class, producer.keyStore());
    }

    @Test
    @DisplayName("redis backend should require a Redis data source")
    void redisBackendShouldRequireRedis() {
        when(config.type()).thenReturn("distributed");
        when(config.distributed().backend()).thenReturn("redis");

        final var error = assertThrows(IllegalStateException.class, () -> producer.keyStore());
        assertTrue(error.getMessage().contains("quarkus.redis.hosts"));
    }

    @Test
    @DisplayName("hashicorp backend should require a token")
    void hashicorpBackendShouldRequireToken() {
        when(config.type()).thenReturn("vault");
        when(config.vault().secretBackend()).thenReturn("hashicorp");
        when(config.vault().hashicorp().url()).thenReturn(Optional.of("http://localhost:8200"));
        when(config.vault().hashicorp().token()).thenReturn(Optional.empty());

        final var error = assertThrows(IllegalStateException.class, () -> producer.keyStore());
        assertTrue(error.getMessage().contains("token"));
    }

    @Test
    @DisplayName("unknown type should fail")
    void unknownTypeShouldFail() {
        when(config.type()).thenReturn("etcd");

        assertThrows(IllegalStateException.class, () -> producer.keyStore());
    }
}
