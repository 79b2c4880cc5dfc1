package io.fleethive.controlplane.connection;

import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Tracks one entry per live transport session and answers liveness questions.
 * <p>
 * A connection is alive while {@code now - lastCommunicatedAt < livenessThreshold()}.
 */
public interface ConnectionRegistry {

    /**
     * Creates an entry with no bound instance and {@code lastCommunicatedAt = now}.
     *
     * @throws io.fleethive.fleet.error.AlreadyExistsException if the id is already registered
     */
    default ConnectionSnapshot register(String connectionId, Instant now) {
        return register(connectionId, TransportType.UNKNOWN, now);
    }

    ConnectionSnapshot register(String connectionId, TransportType transportType, Instant now);

    /**
     * Binds the agent instance id once the agent identified itself.
     *
     * @throws io.fleethive.fleet.error.NotFoundException if the connection is not registered
     */
    void bindInstance(String connectionId, String instanceUid);

    /**
     * Records inbound traffic. No-op for connections that were already removed.
     */
    void touch(String connectionId, Instant now);

    /**
     * Removes the entry. Idempotent.
     */
    void unregister(String connectionId);

    Optional<ConnectionSnapshot> find(String connectionId, Instant now);

    Optional<ConnectionSnapshot> findByInstance(String instanceUid, Instant now);

    boolean isAlive(String connectionId, Instant now);

    /**
     * Connections ordered by id, paginated with the shared list envelope.
     */
    ListResponse<ConnectionSnapshot> list(ListOptions options, Instant now);

    /**
     * Ids of registered connections that are no longer alive at {@code now}.
     */
    List<String> staleConnections(Instant now);

    Duration livenessThreshold();

    int count();
}
