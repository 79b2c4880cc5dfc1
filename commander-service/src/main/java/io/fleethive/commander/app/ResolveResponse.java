package io.fleethive.commander.app;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a dry-run resolution. {@code agentGroup} is absent when no active group matches.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolveResponse(boolean matched, AgentGroupView agentGroup) {
}
