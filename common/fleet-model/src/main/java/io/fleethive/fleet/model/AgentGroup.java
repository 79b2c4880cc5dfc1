package io.fleethive.fleet.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A named policy that selects agents by attributes and supplies their configuration.
 * <p>
 * Groups are soft-deleted. The two lifecycle states are separate record types so that code which
 * must only ever see live groups (selector resolution) can say so in its signature:
 * <ul>
 *   <li>{@link Active} groups take part in resolution and default listings;</li>
 *   <li>{@link Deleted} groups are tombstones, still addressable by name.</li>
 * </ul>
 */
public sealed interface AgentGroup permits AgentGroup.Active, AgentGroup.Deleted {

    String name();

    int priority();

    AgentSelector selector();

    Map<String, String> attributes();

    /**
     * Configuration pushed to matching agents, or {@code null} when the group only classifies agents.
     */
    RemoteConfig remoteConfig();

    Conditions conditions();

    Instant createdAt();

    String createdBy();

    default boolean isDeleted() {
        return this instanceof Deleted;
    }

    record Active(String name,
                  int priority,
                  AgentSelector selector,
                  Map<String, String> attributes,
                  RemoteConfig remoteConfig,
                  Conditions conditions,
                  Instant createdAt,
                  String createdBy) implements AgentGroup {

        public Active {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(createdAt, "createdAt");
            selector = selector == null ? AgentSelector.matchAll() : selector;
            attributes = attributes == null || attributes.isEmpty() ? Map.of() : Map.copyOf(attributes);
            conditions = conditions == null ? Conditions.none() : conditions;
            createdBy = createdBy == null ? "" : createdBy;
        }

        public static Active create(String name,
                                    int priority,
                                    AgentSelector selector,
                                    Map<String, String> attributes,
                                    RemoteConfig remoteConfig,
                                    Instant createdAt,
                                    String createdBy) {
            Conditions conditions = Conditions.none()
                .upsert(Condition.isTrue(ConditionType.CREATED, createdAt, createdBy, "Agent group created"));
            return new Active(name, priority, selector, attributes, remoteConfig, conditions, createdAt, createdBy);
        }

        public Active update(int priority,
                             AgentSelector selector,
                             Map<String, String> attributes,
                             RemoteConfig remoteConfig,
                             Instant updatedAt,
                             String updatedBy) {
            Conditions updated = conditions
                .upsert(Condition.isTrue(ConditionType.UPDATED, updatedAt, updatedBy, "Agent group updated"));
            return new Active(name, priority, selector, attributes, remoteConfig, updated, createdAt, createdBy);
        }

        public Deleted markDeleted(Instant deletedAt, String deletedBy) {
            Objects.requireNonNull(deletedAt, "deletedAt");
            String by = deletedBy == null ? "" : deletedBy;
            Conditions updated = conditions
                .upsert(Condition.isTrue(ConditionType.DELETED, deletedAt, by, "Agent group deleted"));
            return new Deleted(name, priority, selector, attributes, remoteConfig, updated, createdAt, createdBy,
                deletedAt, by);
        }
    }

    record Deleted(String name,
                   int priority,
                   AgentSelector selector,
                   Map<String, String> attributes,
                   RemoteConfig remoteConfig,
                   Conditions conditions,
                   Instant createdAt,
                   String createdBy,
                   Instant deletedAt,
                   String deletedBy) implements AgentGroup {

        public Deleted {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(createdAt, "createdAt");
            Objects.requireNonNull(deletedAt, "deletedAt");
            selector = selector == null ? AgentSelector.matchAll() : selector;
            attributes = attributes == null || attributes.isEmpty() ? Map.of() : Map.copyOf(attributes);
            conditions = conditions == null ? Conditions.none() : conditions;
            createdBy = createdBy == null ? "" : createdBy;
            deletedBy = deletedBy == null ? "" : deletedBy;
        }
    }
}
