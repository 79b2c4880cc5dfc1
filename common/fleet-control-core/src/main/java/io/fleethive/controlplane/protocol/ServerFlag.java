package io.fleethive.controlplane.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ServerFlag {
    /** The agent must send its complete state (description, config hash) with the next message. */
    REPORT_FULL_STATE("ReportFullState");

    private final String wireName;

    ServerFlag(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
