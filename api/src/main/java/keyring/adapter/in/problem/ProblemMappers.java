package keyring.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import keyring.spi.BackendTimeoutException;
import keyring.spi.KeyStoreException;
import keyring.spi.NoActiveKeyException;
import keyring.spi.RotationConflictException;
import keyring.spi.RotationInProgressException;

/**
 * Exception mappers converting key store failures to RFC 7807 Problem Details.
 *
 * <ul>
 *   <li>rotation contention: 409, the caller may retry</li>
 *   <li>no active key or backend timeout: 503</li>
 *   <li>invalid input: 400</li>
 *   <li>any other key store failure: 500</li>
 * </ul>
 */
@ApplicationScoped
public class ProblemMappers {

    private static final Logger LOG = Logger.getLogger(ProblemMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapRotationInProgress(RotationInProgressException e) {
        LOG.infov("Rotation rejected: {0}", e.getMessage());
        return toResponse(LinkProblem.conflict("Another key rotation is in progress; retry later"));
    }

    @ServerExceptionMapper
    public Response mapRotationConflict(RotationConflictException e) {
        LOG.warnv("Rotation conflict: {0}", e.getMessage());
        return toResponse(LinkProblem.conflict("Key rotation conflicted with a concurrent rotation; retry later"));
    }

    @ServerExceptionMapper
    public Response mapNoActiveKey(NoActiveKeyException e) {
        LOG.errorv("No active signing key: {0}", e.getMessage());
        return toResponse(LinkProblem.serviceUnavailable("No active signing key"));
    }

    @ServerExceptionMapper
    public Response mapBackendTimeout(BackendTimeoutException e) {
        LOG.warnv("Key backend timeout: {0}", e.getMessage());
        return toResponse(LinkProblem.serviceUnavailable("Key backend unavailable"));
    }

    @ServerExceptionMapper
    public Response mapKeyStoreException(KeyStoreException e) {
        LOG.errorv(e, "Key store failure: {0}", e.getMessage());
        return toResponse(LinkProblem.internalError("Key store failure"));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(LinkProblem.badRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
