package io.fleethive.commander.app;

public record ErrorResponse(String message) {
}
