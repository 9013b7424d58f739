package keyring.adapter.out.storage.vault;

import java.util.Optional;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import keyring.spi.KeyStoreException;
import keyring.spi.SecretVault;

/**
 * {@link SecretVault} backed by a HashiCorp Vault KV version 2 engine.
 *
 * <h2>Requests</h2>
 * <pre>{@code
 * GET    {url}/v1/{mount}/data/{name}       read latest version
 * POST   {url}/v1/{mount}/data/{name}       write {"data": {"value": ...}}
 * DELETE {url}/v1/{mount}/metadata/{name}   delete every version
 * }</pre>
 *
 * <p>Requests authenticate with the {@code X-Vault-Token} header.
 */
public class HashiCorpVaultSecretVault implements SecretVault {

    private static final Logger LOG = Logger.getLogger(HashiCorpVaultSecretVault.class);
    private static final String VALUE_FIELD = "value";

    private final WebClient webClient;
    private final String baseUrl;
    private final String token;
    private final String mount;

    public HashiCorpVaultSecretVault(Vertx vertx, String baseUrl, String token, String mount) {
        this(WebClient.create(vertx), baseUrl, token, mount);
    }

    HashiCorpVaultSecretVault(WebClient webClient, String baseUrl, String token, String mount) {
        this.webClient = webClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.mount = mount;
        LOG.infov("Initialized HashiCorp Vault secret store at {0} (mount {1})", this.baseUrl, mount);
    }

    @Override
    public String name() {
        return "hashicorp-vault";
    }

    @Override
    public Uni<Optional<String>> getSecret(String secretName) {
        return authorized(webClient.getAbs(dataUrl(secretName))).send().map(response -> {
            if (response.statusCode() == 404) {
                return Optional.<String>empty();
            }
            requireSuccess(response, "read", secretName);
            return Optional.ofNullable(extractValue(response.bodyAsJsonObject()));
        });
    }

    @Override
    public Uni<Void> setSecret(String secretName, String value) {
        final var body = new JsonObject().put("data", new JsonObject().put(VALUE_FIELD, value));
        return authorized(webClient.postAbs(dataUrl(secretName)))
                .putHeader("Content-Type", "application/json")
                .sendJsonObject(body)
                .invoke(response -> requireSuccess(response, "write", secretName))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> deleteSecret(String secretName) {
        return authorized(webClient.deleteAbs(metadataUrl(secretName)))
                .send()
                .invoke(response -> {
                    if (response.statusCode() != 404) {
                        requireSuccess(response, "delete", secretName);
                    }
                })
                .replaceWithVoid();
    }

    private HttpRequest<Buffer> authorized(HttpRequest<Buffer> request) {
        return request.putHeader("X-Vault-Token", token).putHeader("Accept", "application/json");
    }

    private String dataUrl(String secretName) {
        return baseUrl + "/v1/" + mount + "/data/" + secretName;
    }

    private String metadataUrl(String secretName) {
        return baseUrl + "/v1/" + mount + "/metadata/" + secretName;
    }

    private static String extractValue(JsonObject body) {
        if (body == null) {
            return null;
        }
        final var outer = body.getJsonObject("data");
        if (outer == null) {
            return null;
        }
        final var inner = outer.getJsonObject("data");
        return inner == null ? null : inner.getString(VALUE_FIELD);
    }

    private static void requireSuccess(HttpResponse<Buffer> response, String operation, String secretName) {
        final var status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOG.warnv("Vault {0} of {1} failed with status {2}", operation, secretName, status);
            throw new KeyStoreException("Vault " + operation + " of " + secretName + " failed with status " + status);
        }
    }
}
