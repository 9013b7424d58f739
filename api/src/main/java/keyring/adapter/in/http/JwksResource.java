package keyring.adapter.in.http;

import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jwk.Use;
import org.jose4j.jws.AlgorithmIdentifiers;

import keyring.core.model.auth.SigningKey;
import keyring.spi.KeyStore;

/**
 * JWKS (JSON Web Key Set) endpoint exposing the public half of every known
 * signing key, active and inactive, so other services can verify links.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7517">RFC 7517 - JSON Web Key (JWK)</a>
 */
@Path("/.well-known")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class JwksResource {

    private static final Logger LOG = Logger.getLogger(JwksResource.class);
    private static final int CACHE_MAX_AGE_SECONDS = 300;

    private final KeyStore keyStore;

    @Inject
    public JwksResource(KeyStore keyStore) {
        this.keyStore = keyStore;
    }

    /**
     * Get the JWKS.
     *
     * <p>Response format:
     * <pre>{@code
     * {
     *   "keys": [
     *     {"kty": "RSA", "kid": "k-2024-q1-...", "use": "sig", "alg": "RS256", "n": "...", "e": "..."}
     *   ]
     * }
     * }</pre>
     */
    @GET
    @Path("/jwks.json")
    public Uni<Response> getJwks() {
        return keyStore.getAllKeys().map(keys -> {
            final var jwks = toJwks(keys);
            LOG.debugv("Returning JWKS with {0} keys", jwks.size());
            return Response.ok(Map.of("keys", jwks))
                    .header("Cache-Control", "public, max-age=" + CACHE_MAX_AGE_SECONDS)
                    .build();
        });
    }

    static Map<String, Object> toJwk(SigningKey key) {
        final var jwk = new RsaJsonWebKey(key.publicKey());
        jwk.setKeyId(key.keyId());
        jwk.setUse(Use.SIGNATURE);
        jwk.setAlgorithm(AlgorithmIdentifiers.RSA_USING_SHA256);
        return jwk.toParams(JsonWebKey.OutputControlLevel.PUBLIC_ONLY);
    }

    static List<Map<String, Object>> toJwks(List<SigningKey> keys) {
        return keys.stream().map(JwksResource::toJwk).toList();
    }
}
