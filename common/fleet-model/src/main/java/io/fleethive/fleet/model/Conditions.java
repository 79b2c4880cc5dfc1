package io.fleethive.fleet.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable set of conditions keyed by {@link ConditionType}.
 * <p>
 * At most one condition exists per type; {@link #upsert(Condition)} replaces the condition of the
 * same type or adds it. Iteration follows the declaration order of {@link ConditionType}.
 */
public final class Conditions {

    private static final Conditions NONE = new Conditions(new EnumMap<>(ConditionType.class));

    private final Map<ConditionType, Condition> byType;

    private Conditions(EnumMap<ConditionType, Condition> byType) {
        this.byType = Collections.unmodifiableMap(byType);
    }

    public static Conditions none() {
        return NONE;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Conditions of(Collection<Condition> conditions) {
        Conditions result = NONE;
        if (conditions == null) {
            return result;
        }
        for (Condition condition : conditions) {
            result = result.upsert(condition);
        }
        return result;
    }

    public Conditions upsert(Condition condition) {
        Objects.requireNonNull(condition, "condition");
        EnumMap<ConditionType, Condition> copy = byType.isEmpty()
            ? new EnumMap<>(ConditionType.class)
            : new EnumMap<>(byType);
        copy.put(condition.type(), condition);
        return new Conditions(copy);
    }

    public Optional<Condition> get(ConditionType type) {
        return Optional.ofNullable(byType.get(type));
    }

    public boolean isTrue(ConditionType type) {
        Condition condition = byType.get(type);
        return condition != null && condition.status() == ConditionStatus.TRUE;
    }

    @JsonValue
    public List<Condition> asList() {
        return List.copyOf(byType.values());
    }

    public int size() {
        return byType.size();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof Conditions that && byType.equals(that.byType);
    }

    @Override
    public int hashCode() {
        return byType.hashCode();
    }

    @Override
    public String toString() {
        return "Conditions" + asList();
    }
}
