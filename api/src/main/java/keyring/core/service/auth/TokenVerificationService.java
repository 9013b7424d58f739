package keyring.core.service.auth;

import java.time.Clock;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import keyring.core.config.TokenConfig;
import keyring.core.model.auth.LinkVerificationResult;
import keyring.core.model.auth.VerificationFailure;
import keyring.core.service.auth.VerificationKeyResolver.ResolvedKey;

/**
 * Verifies download tokens.
 *
 * <p>
 * The verification key is chosen by the token's {@code kid} header through
 * {@link VerificationKeyResolver}. The token then has to pass:
 * <ul>
 * <li>RS256 signature check (no other algorithm accepted)</li>
 * <li>issuer and audience check</li>
 * <li>exp and nbf check with the configured clock skew</li>
 * <li>presence of the email and file claims</li>
 * </ul>
 *
 * <p>Rejections carry a {@link VerificationFailure} for logging. Key store
 * failures are not rejections and propagate.
 */
@ApplicationScoped
public class TokenVerificationService {

    private static final Logger LOG = Logger.getLogger(TokenVerificationService.class);

    private final VerificationKeyResolver resolver;
    private final TokenConfig config;
    private final Clock clock;

    @Inject
    public TokenVerificationService(VerificationKeyResolver resolver, TokenConfig config) {
        this(resolver, config, Clock.systemUTC());
    }

    TokenVerificationService(VerificationKeyResolver resolver, TokenConfig config, Clock clock) {
        this.resolver = resolver;
        this.config = config;
        this.clock = clock;
    }

    public Uni<LinkVerificationResult> verify(String token) {
        if (token == null || token.isBlank()) {
            return Uni.createFrom().item(unauthorized(VerificationFailure.MISSING_TOKEN, null));
        }

        final String keyId;
        try {
            final var jws = new JsonWebSignature();
            jws.setCompactSerialization(token);
            keyId = jws.getKeyIdHeaderValue();
        } catch (JoseException e) {
            return Uni.createFrom().item(unauthorized(VerificationFailure.MALFORMED_TOKEN, null));
        }

        return resolver.resolve(keyId).map(key -> key.map(k -> validateWithKey(token, k))
                .orElseGet(() -> unauthorized(VerificationFailure.UNKNOWN_SIGNING_KEY, keyId)));
    }

    private LinkVerificationResult validateWithKey(String token, ResolvedKey key) {
        final var consumer = new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds((int) config.clockSkew().toSeconds())
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setExpectedIssuer(config.issuer())
                .setExpectedAudience(config.audience())
                .setVerificationKey(key.publicKey())
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256)
                .build();

        try {
            final var claims = consumer.processToClaims(token);
            return buildValidResult(claims, key.keyId());
        } catch (InvalidJwtException e) {
            LOG.debugv("Token rejected for key {0}: {1}", key.keyId(), e.getMessage());
            return unauthorized(classify(e), key.keyId());
        }
    }

    private LinkVerificationResult buildValidResult(JwtClaims claims, String keyId) {
        try {
            final var email = claims.getStringClaimValue(LinkTokenService.EMAIL_CLAIM);
            final var filePath = claims.getStringClaimValue(LinkTokenService.FILE_CLAIM);
            if (email == null || filePath == null) {
                return unauthorized(VerificationFailure.INVALID_CLAIMS, keyId);
            }
            final var expiresAt = Instant.ofEpochSecond(claims.getExpirationTime().getValue());
            return new LinkVerificationResult.Valid(email, filePath, keyId, expiresAt);
        } catch (MalformedClaimException e) {
            return unauthorized(VerificationFailure.INVALID_CLAIMS, keyId);
        }
    }

    private static VerificationFailure classify(InvalidJwtException e) {
        if (e.hasExpired()) {
            return VerificationFailure.TOKEN_EXPIRED;
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID) || e.hasErrorCode(ErrorCodes.SIGNATURE_MISSING)) {
            return VerificationFailure.INVALID_SIGNATURE;
        }
        return VerificationFailure.INVALID_CLAIMS;
    }

    private static LinkVerificationResult unauthorized(VerificationFailure failure, String keyId) {
        LOG.debugv("Download token unauthorized: {0} (kid {1})", failure, keyId);
        return new LinkVerificationResult.Unauthorized(failure);
    }
}
