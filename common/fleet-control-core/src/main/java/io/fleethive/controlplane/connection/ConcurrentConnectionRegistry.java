package io.fleethive.controlplane.connection;

import io.fleethive.controlplane.pagination.Paginator;
import io.fleethive.fleet.error.AlreadyExistsException;
import io.fleethive.fleet.error.NotFoundException;
import io.fleethive.fleet.error.ValidationException;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConnectionRegistry} over concurrent hash maps.
 * <p>
 * Every operation touches a single key, so churn on one connection never blocks another. A secondary
 * index maps bound instance ids to their current connection.
 */
public class ConcurrentConnectionRegistry implements ConnectionRegistry {

    /** Two OpAMP polling intervals of 30 seconds. */
    public static final Duration DEFAULT_LIVENESS_THRESHOLD = Duration.ofSeconds(60);

    private static final Logger log = LoggerFactory.getLogger(ConcurrentConnectionRegistry.class);

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, String> connectionByInstance = new ConcurrentHashMap<>();
    private final Duration livenessThreshold;
    private final Paginator paginator;

    public ConcurrentConnectionRegistry(Duration livenessThreshold, Paginator paginator) {
        Objects.requireNonNull(livenessThreshold, "livenessThreshold");
        if (livenessThreshold.isZero() || livenessThreshold.isNegative()) {
            throw new IllegalArgumentException("livenessThreshold must be > 0");
        }
        this.livenessThreshold = livenessThreshold;
        this.paginator = Objects.requireNonNull(paginator, "paginator");
    }

    @Override
    public ConnectionSnapshot register(String connectionId, TransportType transportType, Instant now) {
        String id = requireId(connectionId);
        Objects.requireNonNull(now, "now");
        Connection connection = new Connection(id, transportType == null ? TransportType.UNKNOWN : transportType, now);
        if (connections.putIfAbsent(id, connection) != null) {
            throw AlreadyExistsException.of("connection", id);
        }
        ConnectionSnapshot snapshot = connection.snapshot(now, livenessThreshold);
        log.debug("ConnectionRegistry: registered connection={} transport={}", id, snapshot.transportType());
        return snapshot;
    }

    @Override
    public void bindInstance(String connectionId, String instanceUid) {
        if (instanceUid == null || instanceUid.isBlank()) {
            throw new ValidationException("instanceUid must not be blank");
        }
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            throw new NotFoundException("connection '%s' is not registered".formatted(connectionId));
        }
        if (!connection.bind(instanceUid)) {
            throw new AlreadyExistsException("connection '%s' is already bound to instance '%s'"
                .formatted(connectionId, connection.instanceUid()));
        }
        String previous = connectionByInstance.put(instanceUid, connectionId);
        if (previous != null && !previous.equals(connectionId)) {
            log.info("ConnectionRegistry: instance={} moved from connection={} to connection={}",
                instanceUid, previous, connectionId);
        }
    }

    @Override
    public void touch(String connectionId, Instant now) {
        Connection connection = connectionId == null ? null : connections.get(connectionId);
        if (connection != null) {
            connection.touch(now);
        }
    }

    @Override
    public void unregister(String connectionId) {
        if (connectionId == null) {
            return;
        }
        Connection removed = connections.remove(connectionId);
        if (removed == null) {
            return;
        }
        String instanceUid = removed.instanceUid();
        if (instanceUid != null) {
            connectionByInstance.remove(instanceUid, connectionId);
        }
        log.debug("ConnectionRegistry: unregistered connection={} instance={}", connectionId, instanceUid);
    }

    @Override
    public Optional<ConnectionSnapshot> find(String connectionId, Instant now) {
        Connection connection = connectionId == null ? null : connections.get(connectionId);
        return Optional.ofNullable(connection).map(c -> c.snapshot(now, livenessThreshold));
    }

    @Override
    public Optional<ConnectionSnapshot> findByInstance(String instanceUid, Instant now) {
        String connectionId = instanceUid == null ? null : connectionByInstance.get(instanceUid);
        return connectionId == null ? Optional.empty() : find(connectionId, now);
    }

    @Override
    public boolean isAlive(String connectionId, Instant now) {
        Connection connection = connectionId == null ? null : connections.get(connectionId);
        return connection != null && connection.isAlive(now, livenessThreshold);
    }

    @Override
    public ListResponse<ConnectionSnapshot> list(ListOptions options, Instant now) {
        TreeMap<String, ConnectionSnapshot> ordered = new TreeMap<>();
        connections.forEach((id, connection) -> ordered.put(id, connection.snapshot(now, livenessThreshold)));
        return paginator.page(ordered, options);
    }

    @Override
    public List<String> staleConnections(Instant now) {
        return connections.values().stream()
            .filter(connection -> !connection.isAlive(now, livenessThreshold))
            .map(Connection::id)
            .sorted()
            .toList();
    }

    @Override
    public Duration livenessThreshold() {
        return livenessThreshold;
    }

    @Override
    public int count() {
        return connections.size();
    }

    private static String requireId(String connectionId) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new ValidationException("connectionId must not be blank");
        }
        return connectionId;
    }
}
