package keyring.adapter.in.rest;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;

import keyring.adapter.in.problem.LinkProblem;
import keyring.core.service.auth.LinkTokenService;

/**
 * Issues signed download links.
 */
@Path("/api/link")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class LinkResource {

    private final LinkTokenService linkTokenService;

    @Inject
    public LinkResource(LinkTokenService linkTokenService) {
        this.linkTokenService = linkTokenService;
    }

    /**
     * Create a download link for a file.
     *
     * <p>Request:
     * <pre>{@code
     * POST /api/link/secure
     * {"email": "user@example.com", "filePath": "/reports/q1.pdf", "ttlMinutes": 60}
     * }</pre>
     *
     * @return the token, a ready-to-use download URL and the lifetime in seconds
     */
    @POST
    @Path("/secure")
    public Uni<LinkResponse> createSecureLink(LinkRequest request, @Context UriInfo uriInfo) {
        if (request == null) {
            throw LinkProblem.badRequest("Request body is required");
        }
        final var ttl = request.ttlMinutes() == null ? null : Duration.ofMinutes(request.ttlMinutes());

        return linkTokenService.issue(request.email(), request.filePath(), ttl).map(link -> {
            final var downloadUrl = uriInfo.getBaseUriBuilder()
                    .path("api/download")
                    .queryParam("token", link.token())
                    .build()
                    .toString();
            return new LinkResponse(link.token(), downloadUrl, link.lifetime().toSeconds());
        });
    }

    public record LinkRequest(String email, String filePath, Integer ttlMinutes) {}

    public record LinkResponse(String token, String downloadUrl, long expiresIn) {}
}
