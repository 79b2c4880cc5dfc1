package io.fleethive.commander.app;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fleethive.controlplane.agent.AgentRecord;
import java.time.Instant;
import java.util.Map;

/**
 * Agent as shown by the admin API: the inventory record plus whether a live connection is bound to it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentView(String instanceUid,
                        Map<String, String> identifyingAttributes,
                        Map<String, String> nonIdentifyingAttributes,
                        String reportedConfigHash,
                        String effectiveGroup,
                        String connectionId,
                        boolean connected,
                        Instant firstSeenAt,
                        Instant lastSeenAt) {

    public static AgentView from(AgentRecord agent, boolean connected) {
        return new AgentView(agent.instanceUid(), agent.identifyingAttributes(), agent.nonIdentifyingAttributes(),
            agent.reportedConfigHash(), agent.effectiveGroup(), agent.connectionId(), connected,
            agent.firstSeenAt(), agent.lastSeenAt());
    }
}
