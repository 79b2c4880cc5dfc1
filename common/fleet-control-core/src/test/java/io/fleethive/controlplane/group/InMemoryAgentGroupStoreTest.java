package io.fleethive.controlplane.group;

import io.fleethive.controlplane.MutableClock;
import io.fleethive.controlplane.pagination.ContinueTokenCodec;
import io.fleethive.controlplane.pagination.Paginator;
import io.fleethive.fleet.error.AlreadyExistsException;
import io.fleethive.fleet.error.NotFoundException;
import io.fleethive.fleet.error.ValidationException;
import io.fleethive.fleet.model.AgentGroup;
import io.fleethive.fleet.model.AgentSelector;
import io.fleethive.fleet.model.ConditionType;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import io.fleethive.fleet.model.RemoteConfig;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAgentGroupStoreTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private final InMemoryAgentGroupStore store =
        new InMemoryAgentGroupStore(clock, new Paginator(ContinueTokenCodec.withRandomKey()));

    @Test
    void createRecordsAuditAndCondition() {
        AgentGroup.Active created = store.create("prod", spec(10, "env", "prod"), "alice");

        assertThat(created.createdBy()).isEqualTo("alice");
        assertThat(created.createdAt()).isEqualTo(clock.instant());
        assertThat(created.conditions().isTrue(ConditionType.CREATED)).isTrue();
        assertThat(store.get("prod")).isEqualTo(created);
    }

    @Test
    void rejectsInvalidAndDuplicateNames() {
        store.create("prod", spec(1, "env", "prod"), "alice");

        assertThatThrownBy(() -> store.create("prod", spec(2, "env", "prod"), "bob"))
            .isInstanceOf(AlreadyExistsException.class);
        assertThatThrownBy(() -> store.create("Not Valid", spec(1, "env", "prod"), "bob"))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.create("x".repeat(64), spec(1, "env", "prod"), "bob"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void updateReplacesSpecAndKeepsCreationAudit() {
        AgentGroup.Active created = store.create("prod", spec(1, "env", "prod"), "alice");
        clock.advance(Duration.ofMinutes(5));

        AgentGroup.Active updated = store.update("prod", spec(7, "env", "production"), "bob");

        assertThat(updated.priority()).isEqualTo(7);
        assertThat(updated.selector().identifyingAttributes()).containsEntry("env", "production");
        assertThat(updated.createdAt()).isEqualTo(created.createdAt());
        assertThat(updated.conditions().get(ConditionType.UPDATED)).get()
            .satisfies(condition -> {
                assertThat(condition.reason()).isEqualTo("bob");
                assertThat(condition.lastTransitionTime()).isEqualTo(clock.instant());
            });
    }

    @Test
    void deleteTombstonesButKeepsTheGroupAddressable() {
        store.create("prod", spec(1, "env", "prod"), "alice");

        AgentGroup.Deleted deleted = store.delete("prod", "carol");

        assertThat(deleted.deletedBy()).isEqualTo("carol");
        assertThat(store.get("prod")).isInstanceOf(AgentGroup.Deleted.class);
        assertThat(store.activeSnapshot()).isEmpty();
        assertThat(store.delete("prod", "dave")).isEqualTo(deleted);
        assertThatThrownBy(() -> store.update("prod", spec(1, "env", "prod"), "erin"))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.create("prod", spec(1, "env", "prod"), "erin"))
            .isInstanceOf(AlreadyExistsException.class);
    }

    @Test
    void unknownNamesAreNotFound() {
        assertThatThrownBy(() -> store.get("nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.update("nope", spec(1, "a", "b"), "x")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.delete("nope", "x")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void listingHidesTombstonesUnlessAsked() {
        store.create("c", spec(1, "env", "c"), "alice");
        store.create("a", spec(1, "env", "a"), "alice");
        store.create("b", spec(1, "env", "b"), "alice");
        store.delete("b", "alice");

        ListResponse<AgentGroup> visible = store.list(ListOptions.firstPage(), false);
        ListResponse<AgentGroup> all = store.list(ListOptions.firstPage(), true);

        assertThat(visible.items()).extracting(AgentGroup::name).containsExactly("a", "c");
        assertThat(all.items()).extracting(AgentGroup::name).containsExactly("a", "b", "c");
    }

    @Test
    void activeSnapshotFollowsWrites() {
        store.create("low", spec(1, "env", "prod"), "alice");
        assertThat(store.activeSnapshot()).extracting(AgentGroup::name).containsExactly("low");

        store.create("high", spec(9, "env", "prod"), "alice");
        assertThat(store.activeSnapshot()).extracting(AgentGroup::name).containsExactly("high", "low");

        store.delete("high", "alice");
        assertThat(store.activeSnapshot()).extracting(AgentGroup::name).containsExactly("low");
    }

    private static AgentGroupSpec spec(int priority, String key, String value) {
        return new AgentGroupSpec(priority, AgentSelector.identifying(Map.of(key, value)), Map.of(),
            RemoteConfig.of(null, "exporters: {}"));
    }
}
