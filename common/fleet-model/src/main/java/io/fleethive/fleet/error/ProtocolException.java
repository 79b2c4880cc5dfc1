package io.fleethive.fleet.error;

/**
 * Raised for malformed or out-of-contract agent messages. Recoverable: the session stays open.
 */
public class ProtocolException extends FleetException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
