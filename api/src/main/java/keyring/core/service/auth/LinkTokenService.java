package keyring.core.service.auth;

import java.time.Clock;
import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.lang.JoseException;

import keyring.core.config.TokenConfig;
import keyring.core.model.auth.SignedLink;
import keyring.core.model.auth.SigningKey;
import keyring.spi.KeyStore;
import keyring.spi.KeyStoreException;
import keyring.spi.NoActiveKeyException;

/**
 * Issues RS256 download tokens signed with the key store's active key.
 *
 * <p>Every token carries the signing key's id in its {@code kid} header.
 * Claims:
 * <ul>
 * <li>{@code iss}, {@code aud}: from configuration</li>
 * <li>{@code sub}, {@code email}: the principal</li>
 * <li>{@code file}: the file the link grants access to</li>
 * <li>{@code iat}, {@code nbf}, {@code exp}, {@code jti}</li>
 * </ul>
 */
@ApplicationScoped
public class LinkTokenService {

    private static final Logger LOG = Logger.getLogger(LinkTokenService.class);

    static final String EMAIL_CLAIM = "email";
    static final String FILE_CLAIM = "file";

    private final KeyStore keyStore;
    private final TokenConfig config;
    private final Clock clock;

    @Inject
    public LinkTokenService(KeyStore keyStore, TokenConfig config) {
        this(keyStore, config, Clock.systemUTC());
    }

    LinkTokenService(KeyStore keyStore, TokenConfig config, Clock clock) {
        this.keyStore = keyStore;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Sign a download token.
     *
     * @param email    principal the link is issued to
     * @param filePath file the link grants access to
     * @param ttl      requested lifetime; null or non-positive means the default
     * @return Uni with the signed link; fails with {@link IllegalArgumentException}
     *         on blank input and {@link NoActiveKeyException} without an active key
     */
    public Uni<SignedLink> issue(String email, String filePath, Duration ttl) {
        if (email == null || email.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("email is required"));
        }
        if (filePath == null || filePath.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("filePath is required"));
        }
        final var lifetime = effectiveTtl(ttl);
        return keyStore.getActiveKey().map(key -> sign(key, email, filePath, lifetime));
    }

    /**
     * Lifetime actually granted for a requested TTL.
     */
    public Duration effectiveTtl(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return config.defaultLinkTtl();
        }
        if (requested.compareTo(config.maxLinkTtl()) > 0) {
            return config.maxLinkTtl();
        }
        return requested;
    }

    private SignedLink sign(SigningKey key, String email, String filePath, Duration lifetime) {
        if (!key.canSign()) {
            throw new NoActiveKeyException("Key " + key.keyId() + " cannot sign");
        }

        final var issuedAt = clock.instant();
        final var expiresAt = issuedAt.plus(lifetime);

        final var claims = new JwtClaims();
        claims.setIssuer(config.issuer());
        claims.setAudience(config.audience());
        claims.setSubject(email);
        claims.setClaim(EMAIL_CLAIM, email);
        claims.setClaim(FILE_CLAIM, filePath);
        claims.setIssuedAt(NumericDate.fromMilliseconds(issuedAt.toEpochMilli()));
        claims.setNotBefore(NumericDate.fromMilliseconds(issuedAt.toEpochMilli()));
        claims.setExpirationTime(NumericDate.fromMilliseconds(expiresAt.toEpochMilli()));
        claims.setGeneratedJwtId();

        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key.privateKey());
        jws.setKeyIdHeaderValue(key.keyId());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);

        try {
            final var token = jws.getCompactSerialization();
            LOG.debugv("Issued link for {0} with key {1}, expires {2}", filePath, key.keyId(), expiresAt);
            return new SignedLink(token, key.keyId(), issuedAt, expiresAt);
        } catch (JoseException e) {
            throw new KeyStoreException("Failed to sign token with key " + key.keyId(), e);
        }
    }
}
