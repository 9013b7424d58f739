package keyring.spi;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * SPI for the secret vault holding private key material of the vault-backed
 * key store.
 *
 * <p>Secrets are opaque strings addressed by name. Implementations are
 * expected to encrypt at rest and must never log secret values.
 *
 * @see keyring.adapter.out.storage.vault.HashiCorpVaultSecretVault
 * @see keyring.adapter.out.storage.memory.InMemorySecretVault
 */
public interface SecretVault {

    String name();

    /**
     * Read a secret.
     *
     * @param secretName the secret name
     * @return Uni with the secret value, empty if absent
     */
    Uni<Optional<String>> getSecret(String secretName);

    /**
     * Create or overwrite a secret.
     */
    Uni<Void> setSecret(String secretName, String value);

    /**
     * Delete a secret. Deleting an absent secret succeeds.
     */
    Uni<Void> deleteSecret(String secretName);
}
