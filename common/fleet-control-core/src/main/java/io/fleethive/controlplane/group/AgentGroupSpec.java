package io.fleethive.controlplane.group;

import io.fleethive.fleet.model.AgentSelector;
import io.fleethive.fleet.model.RemoteConfig;
import java.util.Map;

/**
 * Mutable part of an agent group, as supplied on create and update.
 */
public record AgentGroupSpec(int priority,
                             AgentSelector selector,
                             Map<String, String> attributes,
                             RemoteConfig remoteConfig) {

    public AgentGroupSpec {
        selector = selector == null ? AgentSelector.matchAll() : selector;
        attributes = attributes == null || attributes.isEmpty() ? Map.of() : Map.copyOf(attributes);
    }
}
