package io.fleethive.fleet.error;

/**
 * Raised when the backing store fails. Never retried by the core.
 */
public class StorageException extends FleetException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
