package io.fleethive.fleet.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An administrative instruction issued to one agent instance.
 * <p>
 * Commands are audit records: once stored they are never changed. The payload map is copied
 * on construction and exposed read-only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Command(UUID id,
                      CommandKind kind,
                      String targetInstanceUid,
                      Map<String, Object> data,
                      Instant createdAt) {

    public Command {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(createdAt, "createdAt");
        if (targetInstanceUid == null || targetInstanceUid.isBlank()) {
            throw new IllegalArgumentException("targetInstanceUid must not be blank");
        }
        // LinkedHashMap rather than Map.copyOf: payloads may carry null values and keep key order
        data = data == null || data.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
