package io.fleethive.controlplane.connection;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of a connection, with liveness evaluated against the caller's "now".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionSnapshot(String id,
                                 String instanceUid,
                                 TransportType transportType,
                                 Instant connectedAt,
                                 Instant lastCommunicatedAt,
                                 boolean alive) {

    public Optional<String> boundInstance() {
        return Optional.ofNullable(instanceUid);
    }
}
