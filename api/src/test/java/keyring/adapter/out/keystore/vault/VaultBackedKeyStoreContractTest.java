package keyring.adapter.out.keystore.vault;

import java.time.Duration;

import com.github.benmanes.caffeine.cache.Ticker;

import keyring.adapter.out.storage.memory.InMemorySecretVault;
import keyring.adapter.out.storage.memory.InMemoryVersionedConfigStore;
import keyring.core.cache.KeyStoreCache;
import keyring.core.service.auth.SigningKeyGenerator;
import keyring.spi.KeyStore;
import keyring.spi.KeyStoreContractTest;

class VaultBackedKeyStoreContractTest extends KeyStoreContractTest {

    @Override
    protected KeyStore createKeyStore() {
        return new VaultBackedKeyStore(
                new InMemorySecretVault(),
                new InMemoryVersionedConfigStore(),
                KeyStoreCache.create(
                        Duration.ofMinutes(5),
                        Duration.ofMinutes(1),
                        1000,
                        0.0,
                        Duration.ofMinutes(5),
                        Ticker.systemTicker()),
                new SigningKeyGenerator(2048),
                Duration.ofSeconds(5),
                new VaultBackedKeyStore.Settings(
                        "jwt-signing-key-", "keyring:config:", 3, Duration.ofMillis(10), false));
    }
}
