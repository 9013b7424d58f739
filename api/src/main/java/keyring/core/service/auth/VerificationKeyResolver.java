package keyring.core.service.auth;

import java.security.interfaces.RSAPublicKey;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyring.core.model.auth.SigningKey;
import keyring.spi.KeyNotFoundException;
import keyring.spi.KeyStore;

/**
 * Finds the public key that verifies a token, strictly by key id.
 *
 * <p>Only the key whose id equals the token's {@code kid} header is ever
 * returned. There is no fallback to other keys: an unknown id resolves to
 * empty and verification fails.
 *
 * <p>The id table is rebuilt only when the store hands back a different key
 * list instance, so cached stores pay for it once per cache refresh.
 */
@ApplicationScoped
public class VerificationKeyResolver {

    private static final Logger LOG = Logger.getLogger(VerificationKeyResolver.class);

    private final KeyStore keyStore;

    private volatile Snapshot snapshot;

    /**
     * A resolved verification key.
     *
     * @param keyId     the key id that matched
     * @param publicKey the RSA public key
     */
    public record ResolvedKey(String keyId, RSAPublicKey publicKey) {}

    private record Snapshot(List<SigningKey> source, Map<String, RSAPublicKey> byId) {}

    @Inject
    public VerificationKeyResolver(KeyStore keyStore) {
        this.keyStore = keyStore;
    }

    /**
     * Resolve the verification key for a key id.
     *
     * @param keyId the {@code kid} header of the token (may be null)
     * @return Uni with the key if the store knows the id, empty otherwise
     */
    public Uni<Optional<ResolvedKey>> resolve(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return keyStore.getAllKeys()
                .map(keys -> Optional.of(lookup(keys, keyId)))
                .onFailure(KeyNotFoundException.class)
                .recoverWithItem(e -> {
                    LOG.debugv("No verification key for kid {0}", keyId);
                    return Optional.empty();
                });
    }

    private ResolvedKey lookup(List<SigningKey> keys, String keyId) {
        final var publicKey = table(keys).get(keyId);
        if (publicKey == null) {
            throw new KeyNotFoundException(keyId);
        }
        return new ResolvedKey(keyId, publicKey);
    }

    private Map<String, RSAPublicKey> table(List<SigningKey> keys) {
        final var current = snapshot;
        if (current != null && current.source() == keys) {
            return current.byId();
        }
        final var byId = new HashMap<String, RSAPublicKey>();
        for (var key : keys) {
            byId.put(key.keyId(), key.publicKey());
        }
        final var table = Map.copyOf(byId);
        snapshot = new Snapshot(keys, table);
        return table;
    }
}
