package io.fleethive.commander.app;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fleethive.fleet.model.AgentGroup;
import io.fleethive.fleet.model.AgentSelector;
import io.fleethive.fleet.model.Conditions;
import io.fleethive.fleet.model.RemoteConfig;
import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentGroupView(String name,
                             int priority,
                             AgentSelector selector,
                             Map<String, String> attributes,
                             RemoteConfig remoteConfig,
                             Conditions conditions,
                             Instant createdAt,
                             String createdBy,
                             boolean deleted,
                             Instant deletedAt,
                             String deletedBy) {

    public static AgentGroupView from(AgentGroup group) {
        Instant deletedAt = null;
        String deletedBy = null;
        if (group instanceof AgentGroup.Deleted tombstone) {
            deletedAt = tombstone.deletedAt();
            deletedBy = tombstone.deletedBy();
        }
        return new AgentGroupView(group.name(), group.priority(), group.selector(), group.attributes(),
            group.remoteConfig(), group.conditions(), group.createdAt(), group.createdBy(),
            group.isDeleted(), deletedAt, deletedBy);
    }
}
