package net.ogimage.exception;

/**
 * The Artifact Store or Task Ledger backend could not be reached or rejected the operation.
 * RETRYABLE: Yes (transient backend issues)
 */
public class StorageUnavailableException extends RuntimeException {

    private final String backend;

    public StorageUnavailableException(String backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public StorageUnavailableException(String backend, String message) {
        this(backend, message, null);
    }

    /**
     * Short label of the failing backend, e.g. {@code task-ledger} or {@code artifact-store}.
     */
    public String getBackend() {
        return backend;
    }
}
