package io.fleethive.controlplane.protocol;

/**
 * In-band error sent instead of closing the session. Messages are generic and never carry internals.
 */
public record ServerErrorResponse(ErrorType type, String message) {

    public enum ErrorType {
        BAD_REQUEST,
        UNAVAILABLE
    }

    public static ServerErrorResponse badRequest() {
        return new ServerErrorResponse(ErrorType.BAD_REQUEST, "malformed or unexpected message");
    }

    public static ServerErrorResponse unavailable() {
        return new ServerErrorResponse(ErrorType.UNAVAILABLE, "server temporarily unavailable");
    }
}
