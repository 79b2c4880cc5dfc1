package io.fleethive.controlplane.group;

import io.fleethive.fleet.model.AgentGroup;
import io.fleethive.fleet.model.AgentSelector;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which agent group governs an agent.
 */
public interface SelectorResolver {

    /**
     * The single effective group for an agent, or empty when no active group matches.
     * Deleted groups in {@code candidates} are ignored.
     */
    Optional<AgentGroup.Active> resolve(Map<String, String> identifyingAttributes,
                                        Collection<? extends AgentGroup> candidates);

    /**
     * Every key of the selector's identifying map must be present in {@code identifyingAttributes}
     * with an equal value. An empty selector matches every agent.
     */
    static boolean matches(Map<String, String> identifyingAttributes, AgentSelector selector) {
        if (selector == null) {
            return true;
        }
        Map<String, String> attributes = identifyingAttributes == null ? Map.of() : identifyingAttributes;
        for (Map.Entry<String, String> required : selector.identifyingAttributes().entrySet()) {
            if (!required.getValue().equals(attributes.get(required.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
