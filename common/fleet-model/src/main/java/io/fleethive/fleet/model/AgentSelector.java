package io.fleethive.fleet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * Attribute-equality selector of an agent group.
 * <p>
 * Only {@code identifyingAttributes} take part in matching. {@code nonIdentifyingAttributes} are
 * kept for operators (display and filtering) and never influence which group an agent receives.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentSelector(Map<String, String> identifyingAttributes,
                            Map<String, String> nonIdentifyingAttributes) {

    public AgentSelector {
        identifyingAttributes = identifyingAttributes == null || identifyingAttributes.isEmpty()
            ? Map.of()
            : Map.copyOf(identifyingAttributes);
        nonIdentifyingAttributes = nonIdentifyingAttributes == null || nonIdentifyingAttributes.isEmpty()
            ? Map.of()
            : Map.copyOf(nonIdentifyingAttributes);
    }

    public static AgentSelector identifying(Map<String, String> identifyingAttributes) {
        return new AgentSelector(identifyingAttributes, null);
    }

    public static AgentSelector matchAll() {
        return new AgentSelector(null, null);
    }
}
