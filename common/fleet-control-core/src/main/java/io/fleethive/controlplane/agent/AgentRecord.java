package io.fleethive.controlplane.agent;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * What the server last learned about one agent instance.
 *
 * @param connectionId   connection the agent last spoke on
 * @param effectiveGroup agent group that governed the agent on its last message, {@code null} for none
 */
public record AgentRecord(String instanceUid,
                          Map<String, String> identifyingAttributes,
                          Map<String, String> nonIdentifyingAttributes,
                          String reportedConfigHash,
                          String effectiveGroup,
                          String connectionId,
                          Instant firstSeenAt,
                          Instant lastSeenAt) {

    public AgentRecord {
        Objects.requireNonNull(instanceUid, "instanceUid");
        Objects.requireNonNull(firstSeenAt, "firstSeenAt");
        Objects.requireNonNull(lastSeenAt, "lastSeenAt");
        identifyingAttributes = identifyingAttributes == null || identifyingAttributes.isEmpty()
            ? Map.of()
            : Map.copyOf(identifyingAttributes);
        nonIdentifyingAttributes = nonIdentifyingAttributes == null || nonIdentifyingAttributes.isEmpty()
            ? Map.of()
            : Map.copyOf(nonIdentifyingAttributes);
    }

    static AgentRecord first(AgentObservation observation) {
        return new AgentRecord(
            observation.instanceUid(),
            observation.identifyingAttributes(),
            observation.nonIdentifyingAttributes(),
            observation.reportedConfigHash(),
            observation.effectiveGroup(),
            observation.connectionId(),
            observation.observedAt(),
            observation.observedAt());
    }

    /**
     * Folds a later observation in. Attributes and the config hash are only replaced when the
     * observation carries them; the effective group always follows the latest resolution.
     */
    AgentRecord merge(AgentObservation observation) {
        boolean described = observation.identifyingAttributes() != null;
        return new AgentRecord(
            instanceUid,
            described ? observation.identifyingAttributes() : identifyingAttributes,
            described ? observation.nonIdentifyingAttributes() : nonIdentifyingAttributes,
            observation.reportedConfigHash() != null ? observation.reportedConfigHash() : reportedConfigHash,
            observation.effectiveGroup(),
            observation.connectionId() != null ? observation.connectionId() : connectionId,
            firstSeenAt,
            observation.observedAt().isAfter(lastSeenAt) ? observation.observedAt() : lastSeenAt);
    }
}
