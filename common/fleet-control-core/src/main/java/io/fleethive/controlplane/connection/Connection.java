package io.fleethive.controlplane.connection;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Registry entry for one live transport session.
 * <p>
 * Only the owning {@link ConnectionRegistry} mutates it; readers get {@link ConnectionSnapshot}s.
 */
final class Connection {

    private final String id;
    private final TransportType transportType;
    private final Instant connectedAt;
    private volatile String instanceUid;
    private volatile Instant lastCommunicatedAt;

    Connection(String id, TransportType transportType, Instant connectedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.transportType = Objects.requireNonNull(transportType, "transportType");
        this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt");
        this.lastCommunicatedAt = connectedAt;
    }

    String id() {
        return id;
    }

    String instanceUid() {
        return instanceUid;
    }

    synchronized boolean bind(String instanceUid) {
        if (this.instanceUid != null) {
            return this.instanceUid.equals(instanceUid);
        }
        this.instanceUid = instanceUid;
        return true;
    }

    synchronized void touch(Instant at) {
        if (at.isAfter(lastCommunicatedAt)) {
            lastCommunicatedAt = at;
        }
    }

    boolean isAlive(Instant now, Duration threshold) {
        return Duration.between(lastCommunicatedAt, now).compareTo(threshold) < 0;
    }

    ConnectionSnapshot snapshot(Instant now, Duration threshold) {
        Instant last = lastCommunicatedAt;
        boolean alive = Duration.between(last, now).compareTo(threshold) < 0;
        return new ConnectionSnapshot(id, instanceUid, transportType, connectedAt, last, alive);
    }
}
