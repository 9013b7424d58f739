package keyring.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import keyring.spi.SecretVault;

/**
 * In-memory implementation of {@link SecretVault}.
 */
public class InMemorySecretVault implements SecretVault {

    private final ConcurrentHashMap<String, String> secrets = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "memory-vault";
    }

    @Override
    public Uni<Optional<String>> getSecret(String secretName) {
        return Uni.createFrom().item(() -> Optional.ofNullable(secrets.get(secretName)));
    }

    @Override
    public Uni<Void> setSecret(String secretName, String value) {
        return Uni.createFrom().item(() -> {
            secrets.put(secretName, value);
            return null;
        });
    }

    @Override
    public Uni<Void> deleteSecret(String secretName) {
        return Uni.createFrom().item(() -> {
            secrets.remove(secretName);
            return null;
        });
    }

    /**
     * Check whether a secret exists. For tests and diagnostics.
     */
    public boolean contains(String secretName) {
        return secrets.containsKey(secretName);
    }
}
