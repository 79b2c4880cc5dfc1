package io.fleethive.controlplane.group;

import io.fleethive.fleet.model.AgentGroup;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

/**
 * Highest priority wins; equal priorities fall back to the lexicographically smallest name, so the
 * outcome never depends on the order of the candidates.
 */
public final class PrioritySelectorResolver implements SelectorResolver {

    static final Comparator<AgentGroup.Active> PRECEDENCE = Comparator
        .comparingInt(AgentGroup.Active::priority).reversed()
        .thenComparing(AgentGroup.Active::name);

    @Override
    public Optional<AgentGroup.Active> resolve(Map<String, String> identifyingAttributes,
                                               Collection<? extends AgentGroup> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        AgentGroup.Active best = null;
        for (AgentGroup candidate : candidates) {
            if (!(candidate instanceof AgentGroup.Active active)) {
                continue;
            }
            if (!SelectorResolver.matches(identifyingAttributes, active.selector())) {
                continue;
            }
            if (best == null || PRECEDENCE.compare(active, best) < 0) {
                best = active;
            }
        }
        return Optional.ofNullable(best);
    }
}
