package io.fleethive.fleet.error;

/**
 * Raised for malformed administrative input such as selectors, names or limits.
 */
public class ValidationException extends FleetException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
