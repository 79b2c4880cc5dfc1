package io.fleethive.controlplane.agent;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One message worth of agent state. {@code identifyingAttributes} is {@code null} when the message
 * carried no self-description, {@code reportedConfigHash} when it carried no hash.
 */
public record AgentObservation(String instanceUid,
                               String connectionId,
                               Map<String, String> identifyingAttributes,
                               Map<String, String> nonIdentifyingAttributes,
                               String reportedConfigHash,
                               String effectiveGroup,
                               Instant observedAt) {

    public AgentObservation {
        Objects.requireNonNull(instanceUid, "instanceUid");
        Objects.requireNonNull(observedAt, "observedAt");
    }
}
