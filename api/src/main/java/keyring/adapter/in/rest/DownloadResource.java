package keyring.adapter.in.rest;

import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import keyring.adapter.in.problem.LinkProblem;
import keyring.core.model.auth.LinkVerificationResult;
import keyring.core.service.auth.TokenVerificationService;

/**
 * Verifies download tokens.
 *
 * <p>Every rejection returns the same 401 body so callers cannot tell an
 * expired token from a forged one.
 */
@Path("/api/download")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class DownloadResource {

    private final TokenVerificationService verificationService;

    @Inject
    public DownloadResource(TokenVerificationService verificationService) {
        this.verificationService = verificationService;
    }

    @GET
    public Uni<DownloadResponse> download(@QueryParam("token") String token) {
        return verificationService.verify(token).map(result -> {
            if (result instanceof LinkVerificationResult.Valid valid) {
                return new DownloadResponse(
                        "Download authorized", valid.email(), valid.filePath(), valid.expiresAt(), valid.keyId());
            }
            throw LinkProblem.unauthorized();
        });
    }

    public record DownloadResponse(String message, String email, String filePath, Instant expiresAt, String kid) {}
}
