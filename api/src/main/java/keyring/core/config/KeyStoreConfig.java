package keyring.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the signing key store.
 *
 * <p>Example configuration:
 * <pre>{@code
 * keyring.key-store.type=distributed
 * keyring.key-store.distributed.backend=redis
 * keyring.key-store.cache.ttl=PT5M
 * keyring.key-store.cache.sliding-window=PT1M
 * keyring.key-store.distributed.lock-wait=PT10S
 * }</pre>
 */
@ConfigMapping(prefix = "keyring.key-store")
public interface KeyStoreConfig {

    /**
     * Which key store backs issuance and verification.
     *
     * <p>Options: memory, distributed, vault.
     */
    @WithDefault("memory")
    String type();

    /**
     * RSA key size in bits.
     *
     * <p>Default: 2048. Higher values (e.g., 4096) provide more security
     * but slower signing/verification.
     */
    @WithName("key-size")
    @WithDefault("2048")
    int keySize();

    /**
     * Upper bound for any single call to a remote backend.
     */
    @WithName("remote-timeout")
    @WithDefault("PT5S")
    Duration remoteTimeout();

    /**
     * How long startup waits for the store to publish its initial key.
     */
    @WithName("init-timeout")
    @WithDefault("PT30S")
    Duration initTimeout();

    /**
     * Process-local cache in front of the remote stores.
     */
    CacheConfig cache();

    /**
     * Settings for type=distributed.
     */
    DistributedConfig distributed();

    /**
     * Settings for type=vault.
     */
    VaultConfig vault();

    interface CacheConfig {
        /**
         * Absolute TTL of cached entries. Bounds how long a retired key can
         * keep validating on another instance. PT0S disables caching.
         */
        @WithDefault("PT5M")
        Duration ttl();

        /**
         * Entries not read for this long expire early.
         */
        @WithName("sliding-window")
        @WithDefault("PT1M")
        Duration slidingWindow();

        @WithName("max-entries")
        @WithDefault("1000")
        long maxEntries();

        /**
         * TTL jitter factor (0.0 to 0.5). Jitter stretches the staleness bound,
         * so it is off by default.
         */
        @WithName("jitter-factor")
        @WithDefault("0.0")
        double jitterFactor();

        /**
         * How long the last successfully loaded key list may be served when
         * the backend fails. PT0S disables the fallback.
         */
        @WithName("stale-if-error")
        @WithDefault("PT5M")
        Duration staleIfError();
    }

    interface DistributedConfig {
        /**
         * Options: redis, memory.
         */
        @WithDefault("redis")
        String backend();

        @WithName("key-prefix")
        @WithDefault("keyring:")
        String keyPrefix();

        @WithName("lock-name")
        @WithDefault("key-rotation")
        String lockName();

        /**
         * Lock expiry, so a crashed holder cannot block rotation forever.
         *
         * <p>Must be at least five times {@code remote-timeout} plus five
         * seconds, so the lease cannot run out while a rotation is still
         * writing. Startup fails otherwise.
         */
        @WithName("lock-lease")
        @WithDefault("PT60S")
        Duration lockLease();

        /**
         * How long rotation waits for the lock before giving up.
         */
        @WithName("lock-wait")
        @WithDefault("PT10S")
        Duration lockWait();

        @WithName("lock-retry-interval")
        @WithDefault("PT0.25S")
        Duration lockRetryInterval();
    }

    interface VaultConfig {
        /**
         * Where private keys live. Options: hashicorp, memory.
         */
        @WithName("secret-backend")
        @WithDefault("hashicorp")
        String secretBackend();

        /**
         * Where the active pointer and key metadata live. Options: redis, memory.
         */
        @WithName("config-backend")
        @WithDefault("redis")
        String configBackend();

        @WithName("secret-prefix")
        @WithDefault("jwt-signing-key-")
        String secretPrefix();

        @WithName("config-prefix")
        @WithDefault("keyring:config:")
        String configPrefix();

        @WithName("max-rotation-attempts")
        @WithDefault("3")
        int maxRotationAttempts();

        /**
         * Initial delay between rotation attempts; doubles on every retry.
         */
        @WithName("rotation-backoff")
        @WithDefault("PT0.1S")
        Duration rotationBackoff();

        /**
         * Keep the private key secret when a key is retired.
         */
        @WithName("retain-secrets-on-retire")
        @WithDefault("false")
        boolean retainSecretsOnRetire();

        HashiCorpConfig hashicorp();
    }

    interface HashiCorpConfig {
        /**
         * Vault base URL, e.g. http://localhost:8200.
         */
        Optional<String> url();

        Optional<String> token();

        /**
         * KV version 2 mount path.
         */
        @WithDefault("secret")
        String mount();
    }
}
