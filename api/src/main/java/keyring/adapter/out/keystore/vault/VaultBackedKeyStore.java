package keyring.adapter.out.keystore.vault;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyring.adapter.out.storage.BackendTimeoutHelper;
import keyring.core.cache.KeyStoreCache;
import keyring.core.config.KeyStoreConfig;
import keyring.core.model.auth.KeyMetadata;
import keyring.core.model.auth.SigningKey;
import keyring.core.service.auth.SigningKeyGenerator;
import keyring.spi.KeyStore;
import keyring.spi.KeyStoreException;
import keyring.spi.NoActiveKeyException;
import keyring.spi.RotationConflictException;
import keyring.spi.SecretVault;
import keyring.spi.VersionConflictException;
import keyring.spi.VersionedConfigStore;
import keyring.spi.VersionedValue;

/**
 * Key store keeping private keys in a {@link SecretVault} and everything else
 * in a {@link VersionedConfigStore}.
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li>secret {@code {secretPrefix}{kid}}: PEM encoded private key</li>
 *   <li>{@code {configPrefix}active-kid}: id of the active key</li>
 *   <li>{@code {configPrefix}all-keys}: JSON array of every key id</li>
 *   <li>{@code {configPrefix}key:{kid}:created-at}: ISO-8601 creation time</li>
 *   <li>{@code {configPrefix}key:{kid}:active}: "true" or "false"</li>
 * </ul>
 *
 * <h2>Rotation</h2>
 * Optimistic. The active pointer is read together with its version, the new
 * key is written and listed, and the pointer is replaced only if its version
 * is unchanged. A lost race removes the new key again and starts over after
 * a growing delay. When every attempt loses, rotation fails with
 * {@link RotationConflictException}.
 *
 * <p>The active flag of listed keys is taken from the active pointer, so a
 * listing never shows two active keys. The per-key flag is kept for operators
 * browsing the config store.
 */
public class VaultBackedKeyStore implements KeyStore {

    private static final Logger LOG = Logger.getLogger(VaultBackedKeyStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {};
    private static final int KEY_LIST_UPDATE_RETRIES = 5;

    private final SecretVault vault;
    private final VersionedConfigStore config;
    private final KeyStoreCache cache;
    private final SigningKeyGenerator generator;
    private final Settings settings;
    private final BackendTimeoutHelper vaultTimeouts;
    private final BackendTimeoutHelper configTimeouts;

    /**
     * Naming and retry settings.
     *
     * @param secretPrefix          prefix of secret names
     * @param configPrefix          prefix of config keys
     * @param maxRotationAttempts   total rotation attempts before giving up
     * @param rotationBackoff       delay before the first retry, doubled afterwards
     * @param retainSecretsOnRetire keep the secret when a key is retired
     */
    public record Settings(
            String secretPrefix,
            String configPrefix,
            int maxRotationAttempts,
            Duration rotationBackoff,
            boolean retainSecretsOnRetire) {

        public static Settings from(KeyStoreConfig.VaultConfig config) {
            return new Settings(
                    config.secretPrefix(),
                    config.configPrefix(),
                    config.maxRotationAttempts(),
                    config.rotationBackoff(),
                    config.retainSecretsOnRetire());
        }
    }

    public VaultBackedKeyStore(
            SecretVault vault,
            VersionedConfigStore config,
            KeyStoreCache cache,
            SigningKeyGenerator generator,
            Duration remoteTimeout,
            Settings settings) {
        this.vault = vault;
        this.config = config;
        this.cache = cache;
        this.generator = generator;
        this.settings = settings;
        this.vaultTimeouts = new BackendTimeoutHelper(remoteTimeout, vault.name());
        this.configTimeouts = new BackendTimeoutHelper(remoteTimeout, config.name());
    }

    @Override
    public String name() {
        return "vault(" + vault.name() + "+" + config.name() + ")";
    }

    // Reads

    @Override
    public Uni<SigningKey> getActiveKey() {
        return activeKeyId().flatMap(id -> {
            if (id.isEmpty()) {
                return Uni.createFrom()
                        .<SigningKey>failure(new NoActiveKeyException("No active signing key published in " + name()));
            }
            return key(id.get()).map(key -> key.map(k -> k.withActive(true))
                    .orElseThrow(() -> new NoActiveKeyException(
                            "Active signing key " + id.get() + " is not loadable from " + name())));
        });
    }

    private Uni<Optional<String>> activeKeyId() {
        final var cached = cache.activeKeyId();
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached);
        }
        final var generation = cache.generation();
        return configTimeouts.withTimeout(config.get(activeKidKey()), "get").map(pointer -> {
            final var id = pointer.map(VersionedValue::value);
            id.ifPresent(activeId -> cache.putActiveKeyId(activeId, generation));
            return id;
        });
    }

    private Uni<Optional<SigningKey>> key(String keyId) {
        final var cached = cache.key(keyId);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached);
        }
        return loadKey(keyId);
    }

    /**
     * Load a key from its metadata and secret. A key missing either one is
     * treated as absent.
     */
    private Uni<Optional<SigningKey>> loadKey(String keyId) {
        final var generation = cache.generation();
        return configTimeouts.withTimeout(config.get(createdAtKey(keyId)), "get").flatMap(createdAt -> {
            if (createdAt.isEmpty()) {
                return Uni.createFrom().item(Optional.<SigningKey>empty());
            }
            return vaultTimeouts.withTimeout(vault.getSecret(secretName(keyId)), "getSecret").map(secret -> {
                if (secret.isEmpty()) {
                    LOG.warnv("Key {0} has metadata but no secret in {1}", keyId, vault.name());
                    return Optional.<SigningKey>empty();
                }
                final var metadata = new KeyMetadata(keyId, parseInstant(keyId, createdAt.get().value()), false);
                final var key = SigningKey.restore(metadata, SigningKey.parsePrivateKey(secret.get()));
                cache.putKey(key, generation);
                return Optional.of(key);
            });
        });
    }

    @Override
    public Uni<List<SigningKey>> getAllKeys() {
        final var cached = cache.allKeys();
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached.get());
        }
        final var generation = cache.generation();
        return loadAllKeys().invoke(keys -> cache.putAllKeys(keys, generation)).onFailure().recoverWithUni(error -> {
            final var stale = cache.lastKnownGood();
            if (stale.isEmpty()) {
                return Uni.createFrom().failure(error);
            }
            LOG.warnv("Serving last-known-good key list from {0} after failure: {1}", name(), error.getMessage());
            return Uni.createFrom().item(stale.get());
        });
    }

    private Uni<List<SigningKey>> loadAllKeys() {
        final var pointer = configTimeouts.withTimeout(config.get(activeKidKey()), "get");
        final var listing = configTimeouts.withTimeout(config.get(allKeysKey()), "get");
        return Uni.combine().all().unis(pointer, listing).asTuple().flatMap(tuple -> {
            final var activeId = tuple.getItem1().map(VersionedValue::value).orElse(null);
            final var ids = tuple.getItem2().map(v -> readIds(v.value())).orElse(List.of());
            if (ids.isEmpty()) {
                return Uni.createFrom().item(List.<SigningKey>of());
            }
            final List<Uni<Optional<SigningKey>>> loads =
                    ids.stream().map(this::loadKey).toList();
            return Uni.join().all(loads).andFailFast().map(keys -> keys.stream()
                    .flatMap(Optional::stream)
                    .map(key -> key.withActive(key.keyId().equals(activeId)))
                    .toList());
        });
    }

    // Rotation

    @Override
    public Uni<SigningKey> createAndActivateNewKey() {
        final var attempt = Uni.createFrom().deferred(this::attemptRotation);
        final var retries = settings.maxRotationAttempts() - 1;
        final Uni<SigningKey> withRetries = retries <= 0
                ? attempt
                : attempt.onFailure(VersionConflictException.class)
                        .retry()
                        .withBackOff(settings.rotationBackoff())
                        .atMost(retries);
        return withRetries
                .onFailure(VaultBackedKeyStore::isVersionConflict)
                .transform(e -> new RotationConflictException(
                        "Key rotation lost to concurrent writers after "
                                + Math.max(1, settings.maxRotationAttempts()) + " attempts",
                        e));
    }

    private Uni<SigningKey> attemptRotation() {
        return configTimeouts.withTimeout(config.get(activeKidKey()), "get").flatMap(pointer -> {
            final var previousId = pointer.map(VersionedValue::value);
            final var expectedVersion = pointer.map(VersionedValue::version);
            final var newKey = generator.generate();
            return publish(newKey, expectedVersion)
                    .flatMap(v -> markActive(previousId, newKey.keyId()))
                    .invoke(() -> {
                        cache.invalidateKey(previousId.orElse(null));
                        LOG.infov(
                                "Rotated signing key in {0}: {1} -> {2}",
                                name(), previousId.orElse("none"), newKey.keyId());
                    })
                    .replaceWith(newKey);
        });
    }

    /**
     * Store the key, list it and point the active id at it, provided the
     * pointer still has the expected version. On conflict the key is removed
     * again before the failure propagates.
     */
    private Uni<Void> publish(SigningKey key, Optional<String> expectedVersion) {
        return storeKey(key)
                .flatMap(v -> updateKeyList(ids -> withId(ids, key.keyId())))
                .flatMap(v -> configTimeouts.withTimeout(
                        config.setIfVersion(activeKidKey(), key.keyId(), expectedVersion), "setIfVersion"))
                .replaceWithVoid()
                .onFailure(VersionConflictException.class)
                .call(e -> {
                    LOG.debugv("Discarding key {0} after losing the active pointer race", key.keyId());
                    return discard(key.keyId());
                });
    }

    private Uni<Void> storeKey(SigningKey key) {
        return vaultTimeouts.withTimeout(vault.setSecret(secretName(key.keyId()), key.privateKeyPem()), "setSecret")
                .flatMap(v -> configTimeouts.withTimeout(
                        config.set(createdAtKey(key.keyId()), key.createdAt().toString()), "set"))
                .flatMap(v -> configTimeouts.withTimeout(config.set(activeFlagKey(key.keyId()), "false"), "set"))
                .replaceWithVoid();
    }

    private Uni<Void> markActive(Optional<String> previousId, String newId) {
        final var activate = configTimeouts.withTimeoutSilent(
                config.set(activeFlagKey(newId), "true").replaceWithVoid(), "set");
        if (previousId.isEmpty() || previousId.get().equals(newId)) {
            return activate;
        }
        return activate.flatMap(v -> configTimeouts.withTimeoutSilent(markInactive(previousId.get()), "markInactive"));
    }

    /**
     * Flip the per-key flag to "false" only while it still exists, so a key
     * retired during rotation does not get its flag written back.
     */
    private Uni<Void> markInactive(String keyId) {
        return config.get(activeFlagKey(keyId)).flatMap(flag -> {
            if (flag.isEmpty()) {
                LOG.debugv("Key {0} was retired during rotation; leaving its flag absent", keyId);
                return Uni.createFrom().voidItem();
            }
            return config.setIfVersion(activeFlagKey(keyId), "false", Optional.of(flag.get().version()))
                    .replaceWithVoid()
                    .onFailure(VersionConflictException.class)
                    .recoverWithItem(() -> {
                        LOG.debugv("Flag of key {0} changed during rotation; not overwriting it", keyId);
                        return null;
                    });
        });
    }

    private Uni<Void> discard(String keyId) {
        return configTimeouts.withTimeoutSilent(updateKeyList(ids -> withoutId(ids, keyId)), "updateKeyList")
                .flatMap(v -> deleteMetadata(keyId))
                .flatMap(v -> vaultTimeouts.withTimeoutSilent(vault.deleteSecret(secretName(keyId)), "deleteSecret"));
    }

    // Retirement

    @Override
    public Uni<Void> retireKey(String keyId) {
        return updateKeyList(ids -> withoutId(ids, keyId))
                .flatMap(v -> configTimeouts.withTimeout(config.delete(createdAtKey(keyId)), "delete"))
                .flatMap(v -> configTimeouts.withTimeout(config.delete(activeFlagKey(keyId)), "delete"))
                .flatMap(v -> settings.retainSecretsOnRetire()
                        ? Uni.createFrom().voidItem()
                        : vaultTimeouts.withTimeout(vault.deleteSecret(secretName(keyId)), "deleteSecret"))
                .invoke(() -> {
                    cache.invalidateKey(keyId);
                    LOG.infov(
                            "Retired signing key {0} in {1}{2}",
                            keyId, name(), settings.retainSecretsOnRetire() ? " (secret retained)" : "");
                });
    }

    // Initialization

    /**
     * Publish an initial key when no active key id exists.
     *
     * <p>The pointer is written with a "must not exist" condition, so when
     * several instances start together exactly one key becomes active and the
     * others discard theirs.
     */
    @Override
    public Uni<Void> initialize() {
        return configTimeouts.withTimeout(config.get(activeKidKey()), "get").flatMap(pointer -> {
            if (pointer.isPresent()) {
                LOG.debugv("Key store {0} already has active key {1}", name(), pointer.get().value());
                return Uni.createFrom().voidItem();
            }
            final var initial = generator.generate();
            return publish(initial, Optional.empty())
                    .flatMap(v -> markActive(Optional.empty(), initial.keyId()))
                    .invoke(() -> {
                        cache.invalidateAll();
                        LOG.infov("Published initial signing key {0} to {1}", initial.keyId(), name());
                    })
                    .onFailure(VaultBackedKeyStore::isVersionConflict)
                    .recoverWithItem(() -> {
                        LOG.infov("Another instance published the initial signing key of {0}", name());
                        return null;
                    });
        });
    }

    // Helpers

    /**
     * Read-modify-write of the key id list, repeated while other writers
     * change it concurrently.
     */
    private Uni<Void> updateKeyList(UnaryOperator<List<String>> change) {
        return Uni.createFrom()
                .deferred(() -> configTimeouts.withTimeout(config.get(allKeysKey()), "get").flatMap(current -> {
                    final var ids = current.map(v -> readIds(v.value())).orElse(List.of());
                    final var updated = change.apply(ids);
                    if (updated.equals(ids) && current.isPresent()) {
                        return Uni.createFrom().voidItem();
                    }
                    return configTimeouts.withTimeout(
                                    config.setIfVersion(
                                            allKeysKey(), writeIds(updated), current.map(VersionedValue::version)),
                                    "setIfVersion")
                            .replaceWithVoid();
                }))
                .onFailure(VersionConflictException.class)
                .retry()
                .atMost(KEY_LIST_UPDATE_RETRIES);
    }

    private Uni<Void> deleteMetadata(String keyId) {
        return configTimeouts.withTimeoutSilent(config.delete(createdAtKey(keyId)), "delete")
                .flatMap(v -> configTimeouts.withTimeoutSilent(config.delete(activeFlagKey(keyId)), "delete"));
    }

    private static List<String> withId(List<String> ids, String keyId) {
        if (ids.contains(keyId)) {
            return ids;
        }
        final var updated = new ArrayList<>(ids);
        updated.add(keyId);
        return updated;
    }

    private static List<String> withoutId(List<String> ids, String keyId) {
        if (!ids.contains(keyId)) {
            return ids;
        }
        final var updated = new ArrayList<>(ids);
        updated.remove(keyId);
        return updated;
    }

    private static boolean isVersionConflict(Throwable e) {
        return e instanceof VersionConflictException || e.getCause() instanceof VersionConflictException;
    }

    private static List<String> readIds(String json) {
        try {
            return MAPPER.readValue(json, ID_LIST);
        } catch (JsonProcessingException e) {
            throw new KeyStoreException("Corrupt key id list in config store", e);
        }
    }

    private static String writeIds(List<String> ids) {
        try {
            return MAPPER.writeValueAsString(ids);
        } catch (JsonProcessingException e) {
            throw new KeyStoreException("Failed to serialize key id list", e);
        }
    }

    private static Instant parseInstant(String keyId, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new KeyStoreException("Corrupt creation time for key " + keyId, e);
        }
    }

    private String secretName(String keyId) {
        return settings.secretPrefix() + keyId;
    }

    private String activeKidKey() {
        return settings.configPrefix() + "active-kid";
    }

    private String allKeysKey() {
        return settings.configPrefix() + "all-keys";
    }

    private String createdAtKey(String keyId) {
        return settings.configPrefix() + "key:" + keyId + ":created-at";
    }

    private String activeFlagKey(String keyId) {
        return settings.configPrefix() + "key:" + keyId + ":active";
    }
}
