package io.fleethive.fleet.error;

/**
 * Raised by lookups of an unknown command, agent group or connection.
 */
public class NotFoundException extends FleetException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public static NotFoundException of(String resource, Object id) {
        return new NotFoundException("%s '%s' not found".formatted(resource, id));
    }
}
