package io.fleethive.controlplane.agent;

import io.fleethive.fleet.model.AgentSelector;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;

/**
 * Every agent instance the server has identified, keyed by instance uid.
 * <p>
 * Unlike connections, records outlive the transport session so operators can see agents that
 * went away. Listings are ordered by instance uid.
 */
public interface AgentInventory {

    AgentRecord observe(AgentObservation observation);

    /**
     * @throws io.fleethive.fleet.error.NotFoundException for an instance never identified
     */
    AgentRecord get(String instanceUid);

    ListResponse<AgentRecord> list(ListOptions options);

    /**
     * Agents whose last identifying attributes match {@code selector}.
     */
    ListResponse<AgentRecord> listBySelector(AgentSelector selector, ListOptions options);

    int count();
}
