package keyring.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Claims and lifetimes of download tokens.
 */
@ConfigMapping(prefix = "keyring.token")
public interface TokenConfig {

    /**
     * Value of the {@code iss} claim, checked on verification.
     */
    @WithDefault("keyring")
    String issuer();

    /**
     * Value of the {@code aud} claim, checked on verification.
     */
    @WithDefault("keyring-downloads")
    String audience();

    /**
     * Link lifetime used when the caller does not ask for one.
     */
    @WithName("default-link-ttl")
    @WithDefault("PT1H")
    Duration defaultLinkTtl();

    /**
     * Upper bound on requested link lifetimes.
     */
    @WithName("max-link-ttl")
    @WithDefault("P1D")
    Duration maxLinkTtl();

    /**
     * Allowed clock difference when checking exp and nbf.
     */
    @WithName("clock-skew")
    @WithDefault("PT30S")
    Duration clockSkew();
}
