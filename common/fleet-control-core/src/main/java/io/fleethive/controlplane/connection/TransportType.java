package io.fleethive.controlplane.connection;

public enum TransportType {
    WEBSOCKET,
    HTTP,
    UNKNOWN
}
