package keyring.adapter.out.keystore.memory;

import keyring.core.service.auth.SigningKeyGenerator;
import keyring.spi.KeyStore;
import keyring.spi.KeyStoreContractTest;

class InMemoryKeyStoreContractTest extends KeyStoreContractTest {

    @Override
    protected KeyStore createKeyStore() {
        return new InMemoryKeyStore(new SigningKeyGenerator(2048));
    }
}
