package keyring.adapter.out.keystore;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import keyring.core.config.KeyStoreConfig;
import keyring.spi.KeyStore;

/**
 * Makes sure the key store has an active key before traffic is served.
 *
 * <p>Startup fails if the store cannot be initialized within
 * {@code keyring.key-store.init-timeout}.
 */
@ApplicationScoped
public class KeyStoreInitializer {

    private static final Logger LOG = Logger.getLogger(KeyStoreInitializer.class);

    private final KeyStore keyStore;
    private final KeyStoreConfig config;

    @Inject
    public KeyStoreInitializer(KeyStore keyStore, KeyStoreConfig config) {
        this.keyStore = keyStore;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.infov("Initializing key store {0}...", keyStore.name());
        try {
            keyStore.initialize().await().atMost(config.initTimeout());
            LOG.infov("Key store {0} initialized", keyStore.name());
        } catch (RuntimeException e) {
            LOG.errorv(e, "Failed to initialize key store {0}", keyStore.name());
            throw e;
        }
    }
}
