package io.fleethive.commander.app;

import io.fleethive.controlplane.group.AgentGroupSpec;
import io.fleethive.fleet.model.AgentSelector;
import io.fleethive.fleet.model.RemoteConfig;
import java.util.Map;

/**
 * Body of agent group create and update requests. {@code name} is ignored on update.
 */
public record AgentGroupRequest(String name,
                                Integer priority,
                                AgentSelector selector,
                                Map<String, String> attributes,
                                RemoteConfig remoteConfig) {

    AgentGroupSpec toSpec() {
        return new AgentGroupSpec(priority == null ? 0 : priority, selector, attributes, remoteConfig);
    }
}
