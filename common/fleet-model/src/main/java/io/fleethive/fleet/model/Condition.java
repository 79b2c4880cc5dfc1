package io.fleethive.fleet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Objects;

/**
 * One lifecycle condition of an agent group. {@code reason} carries the acting user or system.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Condition(ConditionType type,
                        ConditionStatus status,
                        Instant lastTransitionTime,
                        String reason,
                        String message) {

    public Condition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(lastTransitionTime, "lastTransitionTime");
        status = status == null ? ConditionStatus.UNKNOWN : status;
        reason = reason == null ? "" : reason;
        message = message == null ? "" : message;
    }

    public static Condition isTrue(ConditionType type, Instant at, String reason, String message) {
        return new Condition(type, ConditionStatus.TRUE, at, reason, message);
    }
}
