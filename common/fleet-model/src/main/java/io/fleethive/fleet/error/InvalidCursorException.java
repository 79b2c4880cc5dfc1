package io.fleethive.fleet.error;

/**
 * Raised when a continue token is malformed or was not issued by this server.
 */
public class InvalidCursorException extends FleetException {

    public InvalidCursorException(String message) {
        super(message);
    }

    public InvalidCursorException(String message, Throwable cause) {
        super(message, cause);
    }
}
