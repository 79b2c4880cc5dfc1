package io.fleethive.fleet.error;

/**
 * Root of the typed failures raised by the fleet control plane.
 * <p>
 * Each subtype maps to one administrative outcome (not found, conflict, bad request, storage failure)
 * so adapters can translate them without inspecting messages.
 */
public abstract class FleetException extends RuntimeException {

    protected FleetException(String message) {
        super(message);
    }

    protected FleetException(String message, Throwable cause) {
        super(message, cause);
    }
}
