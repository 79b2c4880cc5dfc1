package io.fleethive.commander.app;

import io.fleethive.controlplane.agent.AgentRecord;
import io.fleethive.controlplane.connection.ConnectionRegistry;
import io.fleethive.controlplane.connection.ConnectionSnapshot;
import io.fleethive.fleet.model.ListResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Joins inventory records with the connection registry for the admin API.
 */
@Component
public class AgentViews {

    private final ConnectionRegistry registry;
    private final Clock clock;

    public AgentViews(ConnectionRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AgentView view(AgentRecord agent) {
        return AgentView.from(agent, connected(agent, clock.instant()));
    }

    public ListResponse<AgentView> page(ListResponse<AgentRecord> page) {
        Instant now = clock.instant();
        return page.map(agent -> AgentView.from(agent, connected(agent, now)));
    }

    private boolean connected(AgentRecord agent, Instant now) {
        return registry.findByInstance(agent.instanceUid(), now)
            .map(ConnectionSnapshot::alive)
            .orElse(false);
    }
}
