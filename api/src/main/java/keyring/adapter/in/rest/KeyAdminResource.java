package keyring.adapter.in.rest;

import java.time.Instant;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import keyring.core.model.auth.KeyMetadata;
import keyring.core.model.auth.SigningKey;
import keyring.core.service.auth.KeyRotationService;

/**
 * REST resource for signing key administration.
 *
 * <p>Provides endpoints for:
 * <ul>
 *   <li>Listing all signing keys</li>
 *   <li>Triggering manual key rotation</li>
 *   <li>Retiring keys</li>
 * </ul>
 *
 * <p>Not authenticated; deploy behind a gateway that restricts {@code /api/admin}.
 */
@Path("/api/admin")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class KeyAdminResource {

    private final KeyRotationService keyRotationService;

    @Inject
    public KeyAdminResource(KeyRotationService keyRotationService) {
        this.keyRotationService = keyRotationService;
    }

    /**
     * Trigger immediate key rotation.
     *
     * @param reason Optional reason, logged with the rotation
     * @return The new active key
     */
    @POST
    @Path("/rotate-key")
    public Uni<KeySummaryResponse> rotateKey(@QueryParam("reason") String reason) {
        return keyRotationService
                .triggerRotation(reason != null ? reason : "Manual rotation via admin API")
                .map(KeySummaryResponse::from);
    }

    /**
     * Retire a key. Tokens signed with it stop validating.
     *
     * @param keyId The key identifier to retire
     */
    @POST
    @Path("/retire/{kid}")
    public Uni<MessageResponse> retireKey(@PathParam("kid") String keyId) {
        return keyRotationService.retire(keyId).map(v -> new MessageResponse("Key " + keyId + " retired successfully"));
    }

    /**
     * List all signing keys, oldest first. Key material is never included.
     */
    @GET
    @Path("/keys")
    public Uni<List<KeySummaryResponse>> listKeys() {
        return keyRotationService
                .listKeys()
                .map(keys -> keys.stream().map(KeySummaryResponse::from).toList());
    }

    public record KeySummaryResponse(String kid, Instant createdAt, boolean active) {
        static KeySummaryResponse from(KeyMetadata key) {
            return new KeySummaryResponse(key.keyId(), key.createdAt(), key.active());
        }

        static KeySummaryResponse from(SigningKey key) {
            return from(key.metadata());
        }
    }

    public record MessageResponse(String message) {}
}
