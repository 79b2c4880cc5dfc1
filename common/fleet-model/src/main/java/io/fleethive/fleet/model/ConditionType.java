package io.fleethive.fleet.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle condition types of an agent group. Declaration order is the order conditions are listed in.
 */
public enum ConditionType {
    CREATED("Created"),
    UPDATED("Updated"),
    DELETED("Deleted");

    private final String wireName;

    ConditionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ConditionType fromWireName(String value) {
        for (ConditionType type : values()) {
            if (type.wireName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown condition type '" + value + "'");
    }
}
