package io.fleethive.fleet.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Discriminator for the administrative instructions that can be queued for an agent.
 */
public enum CommandKind {
    UPDATE_AGENT_CONFIG("UpdateAgentConfig"),
    RESTART("Restart"),
    REPORT_FULL_STATE("ReportFullState");

    private final String wireName;

    CommandKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CommandKind fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("command kind must not be blank");
        }
        String trimmed = value.trim();
        for (CommandKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(trimmed) || kind.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown command kind '" + value + "'");
    }
}
