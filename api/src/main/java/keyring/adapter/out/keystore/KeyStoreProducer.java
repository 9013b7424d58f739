package keyring.adapter.out.keystore;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import keyring.adapter.out.keystore.distributed.CachedDistributedKeyStore;
import keyring.adapter.out.keystore.memory.InMemoryKeyStore;
import keyring.adapter.out.keystore.vault.VaultBackedKeyStore;
import keyring.adapter.out.storage.memory.InMemoryRemoteKeyMetadataStore;
import keyring.adapter.out.storage.memory.InMemorySecretVault;
import keyring.adapter.out.storage.memory.InMemoryVersionedConfigStore;
import keyring.adapter.out.storage.redis.RedisKeyMetadataStore;
import keyring.adapter.out.storage.redis.RedisVersionedConfigStore;
import keyring.adapter.out.storage.vault.HashiCorpVaultSecretVault;
import keyring.core.cache.KeyStoreCache;
import keyring.core.config.KeyStoreConfig;
import keyring.core.service.auth.SigningKeyGenerator;
import keyring.spi.KeyStore;
import keyring.spi.RemoteKeyMetadataStore;
import keyring.spi.SecretVault;
import keyring.spi.VersionedConfigStore;

/**
 * Produces the {@link KeyStore} selected by {@code keyring.key-store.type}.
 *
 * <p>Store selection:
 * <ul>
 *   <li>{@code memory}: single-process store, keys lost on restart</li>
 *   <li>{@code distributed}: cached store over Redis (or an in-memory backend)</li>
 *   <li>{@code vault}: private keys in HashiCorp Vault, metadata in Redis
 *       (either side replaceable by an in-memory backend)</li>
 * </ul>
 *
 * <p>Redis and Vert.x are only looked up when the selected store needs them.
 */
@ApplicationScoped
public class KeyStoreProducer {

    private static final Logger LOG = Logger.getLogger(KeyStoreProducer.class);

    private final KeyStoreConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Instance<Vertx> vertx;

    @Inject
    public KeyStoreProducer(
            KeyStoreConfig config, Instance<ReactiveRedisDataSource> redisDataSource, Instance<Vertx> vertx) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.vertx = vertx;
    }

    @Produces
    @ApplicationScoped
    public KeyStore keyStore() {
        final var generator = new SigningKeyGenerator(config.keySize());
        final var store = switch (config.type()) {
            case "memory" -> new InMemoryKeyStore(generator);
            case "distributed" -> new CachedDistributedKeyStore(
                    remoteKeyMetadataStore(),
                    KeyStoreCache.create(config.cache()),
                    generator,
                    config.remoteTimeout(),
                    CachedDistributedKeyStore.RotationLock.from(config.distributed()));
            case "vault" -> new VaultBackedKeyStore(
                    secretVault(),
                    versionedConfigStore(),
                    KeyStoreCache.create(config.cache()),
                    generator,
                    config.remoteTimeout(),
                    VaultBackedKeyStore.Settings.from(config.vault()));
            default -> throw new IllegalStateException("Unknown key store type: " + config.type()
                    + " (expected memory, distributed or vault)");
        };
        LOG.infov("Using key store {0}", store.name());
        return store;
    }

    private RemoteKeyMetadataStore remoteKeyMetadataStore() {
        final var distributed = config.distributed();
        return switch (distributed.backend()) {
            case "redis" -> new RedisKeyMetadataStore(requireRedis(), distributed.keyPrefix());
            case "memory" -> {
                LOG.warn("Distributed key store uses an in-memory backend; keys are not shared between instances");
                yield new InMemoryRemoteKeyMetadataStore();
            }
            default -> throw new IllegalStateException("Unknown distributed backend: " + distributed.backend());
        };
    }

    private SecretVault secretVault() {
        final var vault = config.vault();
        return switch (vault.secretBackend()) {
            case "hashicorp" -> {
                final var hashicorp = vault.hashicorp();
                final var url = hashicorp.url()
                        .orElseThrow(() -> new IllegalStateException(
                                "keyring.key-store.vault.hashicorp.url is required for the hashicorp secret backend"));
                final var token = hashicorp.token()
                        .orElseThrow(() -> new IllegalStateException(
                                "keyring.key-store.vault.hashicorp.token is required for the hashicorp secret backend"));
                yield new HashiCorpVaultSecretVault(vertx.get(), url, token, hashicorp.mount());
            }
            case "memory" -> new InMemorySecretVault();
            default -> throw new IllegalStateException("Unknown secret backend: " + vault.secretBackend());
        };
    }

    private VersionedConfigStore versionedConfigStore() {
        final var vault = config.vault();
        return switch (vault.configBackend()) {
            case "redis" -> new RedisVersionedConfigStore(requireRedis(), vault.configPrefix());
            case "memory" -> new InMemoryVersionedConfigStore();
            default -> throw new IllegalStateException("Unknown config backend: " + vault.configBackend());
        };
    }

    private ReactiveRedisDataSource requireRedis() {
        if (!redisDataSource.isResolvable()) {
            throw new IllegalStateException("Redis data source not available; configure quarkus.redis.hosts");
        }
        return redisDataSource.get();
    }
}
