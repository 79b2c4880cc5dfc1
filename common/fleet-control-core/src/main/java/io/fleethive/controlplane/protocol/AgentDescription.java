package io.fleethive.controlplane.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * Self-description an agent sends once identified, and again whenever its attributes change.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDescription(Map<String, String> identifyingAttributes,
                               Map<String, String> nonIdentifyingAttributes) {

    public AgentDescription {
        identifyingAttributes = identifyingAttributes == null || identifyingAttributes.isEmpty()
            ? Map.of()
            : Map.copyOf(identifyingAttributes);
        nonIdentifyingAttributes = nonIdentifyingAttributes == null || nonIdentifyingAttributes.isEmpty()
            ? Map.of()
            : Map.copyOf(nonIdentifyingAttributes);
    }
}
