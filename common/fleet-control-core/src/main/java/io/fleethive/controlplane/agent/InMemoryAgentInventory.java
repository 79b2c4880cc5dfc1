package io.fleethive.controlplane.agent;

import io.fleethive.controlplane.group.SelectorResolver;
import io.fleethive.controlplane.pagination.Paginator;
import io.fleethive.fleet.error.NotFoundException;
import io.fleethive.fleet.model.AgentSelector;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InMemoryAgentInventory implements AgentInventory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAgentInventory.class);

    private final NavigableMap<String, AgentRecord> agents = new ConcurrentSkipListMap<>();
    private final Paginator paginator;

    public InMemoryAgentInventory(Paginator paginator) {
        this.paginator = Objects.requireNonNull(paginator, "paginator");
    }

    @Override
    public AgentRecord observe(AgentObservation observation) {
        Objects.requireNonNull(observation, "observation");
        return agents.compute(observation.instanceUid(), (uid, current) -> {
            if (current == null) {
                log.info("[CTRL] new agent instance={} connection={}", uid, observation.connectionId());
                return AgentRecord.first(observation);
            }
            return current.merge(observation);
        });
    }

    @Override
    public AgentRecord get(String instanceUid) {
        AgentRecord agent = instanceUid == null ? null : agents.get(instanceUid);
        if (agent == null) {
            throw NotFoundException.of("agent", instanceUid);
        }
        return agent;
    }

    @Override
    public ListResponse<AgentRecord> list(ListOptions options) {
        return paginator.page(agents, options);
    }

    @Override
    public ListResponse<AgentRecord> listBySelector(AgentSelector selector, ListOptions options) {
        NavigableMap<String, AgentRecord> matching = new TreeMap<>();
        for (Map.Entry<String, AgentRecord> entry : agents.entrySet()) {
            if (SelectorResolver.matches(entry.getValue().identifyingAttributes(), selector)) {
                matching.put(entry.getKey(), entry.getValue());
            }
        }
        return paginator.page(matching, options);
    }

    @Override
    public int count() {
        return agents.size();
    }
}
