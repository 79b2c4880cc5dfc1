package io.fleethive.commander.app;

import io.fleethive.fleet.model.CommandKind;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/agents/{instanceUid}/commands}.
 */
public record CommandRequest(CommandKind kind, Map<String, Object> data) {
}
