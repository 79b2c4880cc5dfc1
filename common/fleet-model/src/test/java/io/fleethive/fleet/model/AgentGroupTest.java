package io.fleethive.fleet.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AgentGroupTest {

    private static final Instant CREATED = Instant.parse("2025-03-01T10:00:00Z");

    @Test
    void createRecordsCreatedCondition() {
        AgentGroup.Active group = AgentGroup.Active.create("prod", 5,
            AgentSelector.identifying(Map.of("env", "prod")), null, null, CREATED, "alice");

        assertThat(group.isDeleted()).isFalse();
        assertThat(group.conditions().isTrue(ConditionType.CREATED)).isTrue();
        assertThat(group.conditions().get(ConditionType.CREATED))
            .hasValueSatisfying(condition -> {
                assertThat(condition.reason()).isEqualTo("alice");
                assertThat(condition.lastTransitionTime()).isEqualTo(CREATED);
            });
    }

    @Test
    void repeatedUpdatesReplaceTheUpdatedCondition() {
        AgentGroup.Active group = AgentGroup.Active.create("prod", 5, null, null, null, CREATED, "alice");

        AgentGroup.Active once = group.update(6, null, null, null, CREATED.plusSeconds(10), "bob");
        AgentGroup.Active twice = once.update(7, null, null, null, CREATED.plusSeconds(20), "carol");

        assertThat(twice.conditions().size()).isEqualTo(2);
        assertThat(twice.conditions().get(ConditionType.UPDATED))
            .hasValueSatisfying(condition -> assertThat(condition.reason()).isEqualTo("carol"));
        assertThat(twice.priority()).isEqualTo(7);
        assertThat(twice.createdAt()).isEqualTo(CREATED);
    }

    @Test
    void markDeletedProducesTombstoneWithAuditFields() {
        AgentGroup.Active group = AgentGroup.Active.create("prod", 5, null, Map.of("team", "obs"),
            RemoteConfig.of(null, "receivers: {}"), CREATED, "alice");

        AgentGroup.Deleted deleted = group.markDeleted(CREATED.plusSeconds(60), "bob");

        assertThat(deleted.isDeleted()).isTrue();
        assertThat(deleted.deletedAt()).isEqualTo(CREATED.plusSeconds(60));
        assertThat(deleted.deletedBy()).isEqualTo("bob");
        assertThat(deleted.attributes()).containsEntry("team", "obs");
        assertThat(deleted.conditions().asList())
            .extracting(Condition::type)
            .containsExactly(ConditionType.CREATED, ConditionType.DELETED);
    }

    @Test
    void remoteConfigHashDependsOnBodyOnly() {
        RemoteConfig yaml = RemoteConfig.of("application/yaml", "exporters: {}");
        RemoteConfig text = RemoteConfig.of("text/plain", "exporters: {}");
        RemoteConfig other = RemoteConfig.of("application/yaml", "exporters: {debug: {}}");

        assertThat(yaml.hash()).isEqualTo(text.hash()).hasSize(64);
        assertThat(other.hash()).isNotEqualTo(yaml.hash());
    }
}
