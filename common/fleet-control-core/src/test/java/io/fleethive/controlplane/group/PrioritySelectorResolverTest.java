package io.fleethive.controlplane.group;

import io.fleethive.fleet.model.AgentGroup;
import io.fleethive.fleet.model.AgentSelector;
import io.fleethive.fleet.model.RemoteConfig;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PrioritySelectorResolverTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Map<String, String> PROD_LINUX = Map.of("env", "prod", "os", "linux");

    private final SelectorResolver resolver = new PrioritySelectorResolver();

    @Test
    void highestPriorityMatchWins() {
        AgentGroup.Active low = group("all-prod", 1, Map.of("env", "prod"));
        AgentGroup.Active high = group("prod-linux", 10, Map.of("env", "prod", "os", "linux"));

        assertThat(resolver.resolve(PROD_LINUX, List.of(low, high))).contains(high);
    }

    @Test
    void nonMatchingGroupsAreSkippedWhateverTheirPriority() {
        AgentGroup.Active windows = group("windows", 100, Map.of("os", "windows"));
        AgentGroup.Active prod = group("prod", 1, Map.of("env", "prod"));

        assertThat(resolver.resolve(PROD_LINUX, List.of(windows, prod))).contains(prod);
        assertThat(resolver.resolve(Map.of("env", "dev"), List.of(windows, prod))).isEmpty();
    }

    @Test
    void tiesGoToTheSmallestNameRegardlessOfOrder() {
        List<AgentGroup> candidates = new ArrayList<>(List.of(
            group("zeta", 5, Map.of("env", "prod")),
            group("alpha", 5, Map.of("env", "prod")),
            group("mid", 5, Map.of())));
        Random random = new Random(42);

        for (int i = 0; i < 20; i++) {
            Collections.shuffle(candidates, random);
            assertThat(resolver.resolve(PROD_LINUX, candidates)).get()
                .extracting(AgentGroup.Active::name).isEqualTo("alpha");
        }
    }

    @Test
    void emptySelectorMatchesEveryAgent() {
        AgentGroup.Active catchAll = group("default", 0, Map.of());

        assertThat(resolver.resolve(Map.of(), List.of(catchAll))).contains(catchAll);
        assertThat(SelectorResolver.matches(null, AgentSelector.matchAll())).isTrue();
    }

    @Test
    void nonIdentifyingSelectorAttributesAreIgnored() {
        AgentSelector selector = new AgentSelector(Map.of("env", "prod"), Map.of("team", "payments"));

        assertThat(SelectorResolver.matches(Map.of("env", "prod"), selector)).isTrue();
    }

    @Test
    void deletedGroupsNeverMatch() {
        AgentGroup.Active a = group("a", 10, Map.of("env", "prod"));
        AgentGroup.Active b = group("b", 5, Map.of("env", "prod"));
        AgentGroup.Deleted deletedA = a.markDeleted(T0.plusSeconds(60), "admin");

        assertThat(resolver.resolve(PROD_LINUX, List.of(a, b))).contains(a);
        assertThat(resolver.resolve(PROD_LINUX, List.of(deletedA, b))).contains(b);
        assertThat(resolver.resolve(PROD_LINUX, List.of(deletedA))).isEmpty();
    }

    @Test
    void noCandidatesIsNotAnError() {
        assertThat(resolver.resolve(PROD_LINUX, List.of())).isEmpty();
        assertThat(resolver.resolve(PROD_LINUX, null)).isEmpty();
    }

    private static AgentGroup.Active group(String name, int priority, Map<String, String> identifying) {
        return AgentGroup.Active.create(name, priority, AgentSelector.identifying(identifying), Map.of(),
            RemoteConfig.of("application/yaml", "receivers: {}  # " + name), T0, "admin");
    }
}
