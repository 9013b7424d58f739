package keyring.spi;

/**
 * Thrown when a call to a remote key backend exceeds its timeout.
 */
public class BackendTimeoutException extends KeyStoreException {

    private final String operation;
    private final String backend;

    public BackendTimeoutException(String operation, String backend) {
        super("Backend operation timeout: " + operation + " in " + backend);
        this.operation = operation;
        this.backend = backend;
    }

    /** Returns the name of the operation that timed out. */
    public String getOperation() {
        return operation;
    }

    /** Returns the backend where the timeout occurred. */
    public String getBackend() {
        return backend;
    }
}
