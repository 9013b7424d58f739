package keyring.adapter.out.storage.redis;

import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;

import keyring.spi.KeyStoreException;
import keyring.spi.VersionConflictException;
import keyring.spi.VersionedConfigStore;
import keyring.spi.VersionedValue;

/**
 * Redis implementation of {@link VersionedConfigStore}.
 *
 * <p>Each setting is a hash with {@code value} and {@code version} fields.
 * Versions come from a single counter, so a setting that is deleted and
 * written again never reuses an earlier version.
 */
public class RedisVersionedConfigStore implements VersionedConfigStore {

    private static final String VALUE_FIELD = "value";
    private static final String VERSION_FIELD = "version";

    /**
     * Writes a setting unconditionally.
     *
     * <ol>
     *   <li>KEYS[1] - the setting key</li>
     *   <li>KEYS[2] - the version counter</li>
     *   <li>ARGV[1] - new value</li>
     * </ol>
     *
     * <p>Returns the new version.
     */
    private static final String SET_SCRIPT =
            """
            local version = redis.call('INCR', KEYS[2])
            redis.call('HSET', KEYS[1], 'value', ARGV[1], 'version', version)
            return version
            """;

    /**
     * Writes a setting only if its version matches.
     *
     * <ol>
     *   <li>KEYS[1] - the setting key</li>
     *   <li>KEYS[2] - the version counter</li>
     *   <li>ARGV[1] - new value</li>
     *   <li>ARGV[2] - expected version, empty if the setting must not exist</li>
     * </ol>
     *
     * <p>Returns the new version, or -1 on a version mismatch.
     */
    private static final String COMPARE_AND_SET_SCRIPT =
            """
            local current = redis.call('HGET', KEYS[1], 'version')
            if ARGV[2] == '' then
                if current then
                    return -1
                end
            elseif current ~= ARGV[2] then
                return -1
            end
            local version = redis.call('INCR', KEYS[2])
            redis.call('HSET', KEYS[1], 'value', ARGV[1], 'version', version)
            return version
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String versionCounterKey;

    public RedisVersionedConfigStore(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.versionCounterKey = keyPrefix + "version-counter";
    }

    @Override
    public String name() {
        return "redis-config";
    }

    @Override
    public Uni<Optional<VersionedValue>> get(String key) {
        return hashCommands.hgetall(key).map(fields -> {
            final var value = fields.get(VALUE_FIELD);
            final var version = fields.get(VERSION_FIELD);
            if (value == null || version == null) {
                return Optional.empty();
            }
            return Optional.of(new VersionedValue(value, version));
        });
    }

    @Override
    public Uni<VersionedValue> set(String key, String value) {
        return redisDataSource
                .execute("EVAL", SET_SCRIPT, "2", key, versionCounterKey, value)
                .map(response -> new VersionedValue(value, version(response)));
    }

    @Override
    public Uni<VersionedValue> setIfVersion(String key, String value, Optional<String> expectedVersion) {
        return redisDataSource
                .execute("EVAL", COMPARE_AND_SET_SCRIPT, "2", key, versionCounterKey, value, expectedVersion.orElse(""))
                .map(response -> {
                    final var version = version(response);
                    if ("-1".equals(version)) {
                        throw new VersionConflictException(key);
                    }
                    return new VersionedValue(value, version);
                });
    }

    @Override
    public Uni<Void> delete(String key) {
        return keyCommands.del(key).replaceWithVoid();
    }

    private static String version(Response response) {
        if (response == null) {
            throw new KeyStoreException("Null response from Redis");
        }
        return String.valueOf(response.toLong());
    }
}
