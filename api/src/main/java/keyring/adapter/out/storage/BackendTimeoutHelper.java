package keyring.adapter.out.storage;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import keyring.spi.BackendTimeoutException;

/**
 * Helper for bounding every call a key store makes to a remote backend.
 *
 * <h2>Operation Modes</h2>
 * <ul>
 *   <li>{@link #withTimeout} - Fail-fast: fails with {@link BackendTimeoutException}
 *       on timeout and propagates other failures. Used for reads and writes of
 *       key state.</li>
 *   <li>{@link #withTimeoutSilent} - Fire-and-forget: logs but ignores timeout or
 *       any failure. Used for lock release and cleanup, where the lease or a
 *       later retirement takes care of leftovers.</li>
 * </ul>
 */
public class BackendTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(BackendTimeoutHelper.class);

    private final Duration timeout;
    private final String backendName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout     the timeout for each backend operation
     * @param backendName backend name for logging
     */
    public BackendTimeoutHelper(Duration timeout, String backendName) {
        this.timeout = timeout;
        this.backendName = backendName;
    }

    /**
     * Apply timeout to an operation that should fail on timeout.
     *
     * @param operation     the backend operation
     * @param operationName name for logging
     * @param <T>           the result type
     * @return a Uni that fails with BackendTimeoutException on timeout; other failures propagate
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Backend operation timeout: {0} in {1} after {2}", operationName, backendName, timeout);
            return new BackendTimeoutException(operationName, backendName);
        });
    }

    /**
     * Apply timeout with silent failure.
     *
     * @param operation     the backend operation
     * @param operationName name for logging
     * @return a Uni that completes with void on timeout or failure
     */
    public Uni<Void> withTimeoutSilent(Uni<Void> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> {
                    LOG.warnv(
                            "Backend operation timeout (silent): {0} in {1} after {2}",
                            operationName, backendName, timeout);
                    return null;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Backend operation failure (silent): {0} in {1}: {2}",
                            operationName, backendName, error.getMessage());
                    return null;
                });
    }

    public Duration timeout() {
        return timeout;
    }
}
