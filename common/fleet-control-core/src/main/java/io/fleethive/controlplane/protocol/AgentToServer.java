package io.fleethive.controlplane.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Inbound protocol message.
 *
 * @param instanceUid            agent instance id; required together with a description
 * @param sequenceNum            monotonically increasing per agent, {@code null} when the agent does not number messages
 * @param agentDescription       present on the first message and whenever attributes change
 * @param reportedConfigHash     hash of the remote configuration the agent currently runs
 * @param acknowledgedCommandIds ids of commands the agent has executed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentToServer(String instanceUid,
                            Long sequenceNum,
                            AgentDescription agentDescription,
                            String reportedConfigHash,
                            List<String> acknowledgedCommandIds) {

    public AgentToServer {
        acknowledgedCommandIds = acknowledgedCommandIds == null ? List.of() : List.copyOf(acknowledgedCommandIds);
    }
}
