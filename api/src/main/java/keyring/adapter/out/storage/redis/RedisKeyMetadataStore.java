package keyring.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyring.core.model.auth.KeyMetadata;
import keyring.core.model.auth.SigningKey;
import keyring.spi.KeyStoreException;
import keyring.spi.RemoteKeyMetadataStore;

/**
 * Redis implementation of {@link RemoteKeyMetadataStore}.
 *
 * <p>Key format:
 * <ul>
 *   <li>Key record: {@code {prefix}key:{kid}} (JSON, private key as base64 PKCS8)</li>
 *   <li>Key listing: {@code {prefix}keys} (set of ids)</li>
 *   <li>Active pointer: {@code {prefix}active}</li>
 *   <li>Locks: {@code {prefix}lock:{name}} (owner token, PX lease)</li>
 * </ul>
 */
public class RedisKeyMetadataStore implements RemoteKeyMetadataStore {

    private static final Logger LOG = Logger.getLogger(RedisKeyMetadataStore.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * Deletes the lock only while it still holds the caller's owner token.
     *
     * <ol>
     *   <li>KEYS[1] - the lock key</li>
     *   <li>ARGV[1] - owner token</li>
     * </ol>
     */
    private static final String RELEASE_LOCK_SCRIPT =
            """
            if redis.call('GET', KEYS[1]) == ARGV[1] then
                return redis.call('DEL', KEYS[1])
            end
            return 0
            """;

    /**
     * Overwrites a key record only if it still exists. The listing set is
     * left alone.
     *
     * <ol>
     *   <li>KEYS[1] - the key record</li>
     *   <li>ARGV[1] - replacement JSON</li>
     * </ol>
     */
    private static final String REPLACE_IF_EXISTS_SCRIPT =
            """
            if redis.call('EXISTS', KEYS[1]) == 1 then
                redis.call('SET', KEYS[1], ARGV[1])
                return 1
            end
            return 0
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;

    /**
     * Persisted form of a key record.
     */
    record StoredSigningKey(String keyId, String createdAt, boolean active, String privateKey) {}

    public RedisKeyMetadataStore(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.setCommands = redisDataSource.set(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix;
        LOG.infov("Initialized Redis key metadata store with prefix {0}", keyPrefix);
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Uni<Optional<SigningKey>> getKey(String keyId) {
        return valueCommands.get(keyFor(keyId)).map(json -> {
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(deserialize(json));
        });
    }

    @Override
    public Uni<Void> saveKey(SigningKey key) {
        return valueCommands
                .set(keyFor(key.keyId()), serialize(key))
                .flatMap(v -> setCommands.sadd(listingKey(), key.keyId()))
                .replaceWithVoid();
    }

    @Override
    public Uni<Boolean> deactivateKey(SigningKey key) {
        return redisDataSource
                .execute("EVAL", REPLACE_IF_EXISTS_SCRIPT, "1", keyFor(key.keyId()), serialize(key.deactivate()))
                .map(response -> response != null && response.toLong() == 1);
    }

    @Override
    public Uni<Optional<String>> getActiveKeyId() {
        return valueCommands.get(activeKey()).map(Optional::ofNullable);
    }

    @Override
    public Uni<Void> setActiveKeyId(String keyId) {
        return valueCommands.set(activeKey(), keyId);
    }

    @Override
    public Uni<List<String>> listKeyIds() {
        return setCommands.smembers(listingKey()).map(List::copyOf);
    }

    @Override
    public Uni<Void> deleteKey(String keyId) {
        return keyCommands
                .del(keyFor(keyId))
                .flatMap(deleted -> setCommands.srem(listingKey(), keyId))
                .replaceWithVoid();
    }

    @Override
    public Uni<Optional<String>> tryAcquireLock(String lockName, Duration lease) {
        final var ownerToken = UUID.randomUUID().toString();
        // SET key token NX PX lease replies nil when the key already exists
        return redisDataSource
                .execute("SET", lockFor(lockName), ownerToken, "NX", "PX", String.valueOf(lease.toMillis()))
                .map(response -> response == null ? Optional.<String>empty() : Optional.of(ownerToken));
    }

    @Override
    public Uni<Void> releaseLock(String lockName, String ownerToken) {
        // EVAL script numkeys key [key...] arg [arg...]
        return redisDataSource
                .execute("EVAL", RELEASE_LOCK_SCRIPT, "1", lockFor(lockName), ownerToken)
                .invoke(response -> {
                    if (response == null || response.toLong() == 0) {
                        LOG.warnv("Lock {0} was no longer held by this instance on release", lockName);
                    }
                })
                .replaceWithVoid();
    }

    private String keyFor(String keyId) {
        return keyPrefix + "key:" + keyId;
    }

    private String listingKey() {
        return keyPrefix + "keys";
    }

    private String activeKey() {
        return keyPrefix + "active";
    }

    private String lockFor(String lockName) {
        return keyPrefix + "lock:" + lockName;
    }

    static String serialize(SigningKey key) {
        final var stored = new StoredSigningKey(
                key.keyId(), key.createdAt().toString(), key.active(), key.privateKeyBase64());
        try {
            return OBJECT_MAPPER.writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new KeyStoreException("Failed to serialize signing key " + key.keyId(), e);
        }
    }

    static SigningKey deserialize(String json) {
        try {
            final var stored = OBJECT_MAPPER.readValue(json, StoredSigningKey.class);
            final var metadata = new KeyMetadata(stored.keyId(), Instant.parse(stored.createdAt()), stored.active());
            return SigningKey.restore(metadata, SigningKey.parsePrivateKey(stored.privateKey()));
        } catch (JsonProcessingException e) {
            throw new KeyStoreException("Failed to deserialize signing key", e);
        }
    }
}
