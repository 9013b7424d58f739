package keyring.adapter.out.keystore.memory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyring.core.model.auth.SigningKey;
import keyring.core.service.auth.SigningKeyGenerator;
import keyring.spi.KeyStore;
import keyring.spi.NoActiveKeyException;

/**
 * Key store living entirely in this process.
 *
 * <p>The map is authoritative and reads are lock-free. Mutations take a single
 * lock so a rotation and a retirement never interleave. An initial key is
 * generated on construction, so the store is usable immediately.
 *
 * <p>Keys are lost on restart; tokens outlive the process only as long as
 * another instance of the same deployment is not needed to verify them.
 */
public class InMemoryKeyStore implements KeyStore {

    private static final Logger LOG = Logger.getLogger(InMemoryKeyStore.class);

    private final ConcurrentHashMap<String, SigningKey> keys = new ConcurrentHashMap<>();
    private final ReentrantLock mutationLock = new ReentrantLock();
    private final SigningKeyGenerator generator;

    private volatile String activeKeyId;

    public InMemoryKeyStore(SigningKeyGenerator generator) {
        this.generator = generator;
        final var initial = generator.generate();
        keys.put(initial.keyId(), initial);
        activeKeyId = initial.keyId();
        LOG.infov("Generated initial signing key {0}", initial.keyId());
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Uni<SigningKey> getActiveKey() {
        return Uni.createFrom().item(() -> {
            final var id = activeKeyId;
            final var key = id == null ? null : keys.get(id);
            if (key == null) {
                throw new NoActiveKeyException("No active signing key available");
            }
            return key;
        });
    }

    @Override
    public Uni<List<SigningKey>> getAllKeys() {
        return Uni.createFrom().item(() -> List.copyOf(keys.values()));
    }

    @Override
    public Uni<SigningKey> createAndActivateNewKey() {
        return Uni.createFrom().item(this::rotate);
    }

    private SigningKey rotate() {
        // Generate outside the lock, RSA key generation is slow
        final var newKey = generator.generate();
        mutationLock.lock();
        try {
            final var previousId = activeKeyId;
            if (previousId != null) {
                keys.computeIfPresent(previousId, (id, key) -> key.deactivate());
            }
            keys.put(newKey.keyId(), newKey);
            activeKeyId = newKey.keyId();
            LOG.infov("Rotated signing key: {0} -> {1}", previousId, newKey.keyId());
            return newKey;
        } finally {
            mutationLock.unlock();
        }
    }

    @Override
    public Uni<Void> retireKey(String keyId) {
        return Uni.createFrom().item(() -> {
            mutationLock.lock();
            try {
                final var removed = keys.remove(keyId);
                if (removed == null) {
                    LOG.debugv("Retire ignored, unknown key {0}", keyId);
                    return null;
                }
                if (keyId.equals(activeKeyId)) {
                    activeKeyId = null;
                    LOG.warnv("Retired the active signing key {0}; no key is active until the next rotation", keyId);
                } else {
                    LOG.infov("Retired signing key {0}", keyId);
                }
                return null;
            } finally {
                mutationLock.unlock();
            }
        });
    }
}
