package io.fleethive.fleet.error;

/**
 * Raised when a unique identifier (agent group name, connection id, command id) is already taken.
 */
public class AlreadyExistsException extends FleetException {

    public AlreadyExistsException(String message) {
        super(message);
    }

    public AlreadyExistsException(String message, Throwable cause) {
        super(message, cause);
    }

    public static AlreadyExistsException of(String resource, Object id) {
        return new AlreadyExistsException("%s '%s' already exists".formatted(resource, id));
    }
}
