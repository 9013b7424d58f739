package keyring.core.service.auth;

import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyring.core.model.auth.KeyMetadata;
import keyring.core.model.auth.SigningKey;
import keyring.spi.KeyStore;

/**
 * Operator-facing key lifecycle operations.
 *
 * <p>Rotation can be triggered manually or by the
 * {@code keyring.key-rotation.schedule} cron expression (off by default).
 * Retirement is always manual.
 */
@ApplicationScoped
public class KeyRotationService {

    private static final Logger LOG = Logger.getLogger(KeyRotationService.class);

    private final KeyStore keyStore;

    @Inject
    public KeyRotationService(KeyStore keyStore) {
        this.keyStore = keyStore;
    }

    /**
     * Trigger scheduled key rotation.
     */
    @Scheduled(
            cron = "${keyring.key-rotation.schedule:off}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> rotateOnSchedule() {
        LOG.info("Starting scheduled key rotation...");
        return keyStore.createAndActivateNewKey()
                .invoke(key -> LOG.infov("Scheduled rotation completed: new active key {0}", key.keyId()))
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Scheduled key rotation failed", e));
    }

    /**
     * Manually trigger key rotation.
     *
     * @param reason Optional reason for the rotation (logged)
     * @return Uni with the new active key
     */
    public Uni<SigningKey> triggerRotation(String reason) {
        LOG.warnv("Manual key rotation triggered: {0}", reason != null ? reason : "no reason provided");
        return keyStore.createAndActivateNewKey()
                .invoke(key -> LOG.infov("Manual rotation completed: new active key {0}", key.keyId()));
    }

    /**
     * Permanently retire a key. Tokens signed with it stop validating once
     * every instance's cache has expired.
     */
    public Uni<Void> retire(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("keyId is required"));
        }
        LOG.warnv("Retiring signing key {0}", keyId);
        return keyStore.retireKey(keyId);
    }

    /**
     * List every known key, oldest first, without key material.
     */
    public Uni<List<KeyMetadata>> listKeys() {
        return keyStore.getAllKeys().map(keys -> keys.stream()
                .map(SigningKey::metadata)
                .sorted(Comparator.comparing(KeyMetadata::createdAt))
                .toList());
    }
}
