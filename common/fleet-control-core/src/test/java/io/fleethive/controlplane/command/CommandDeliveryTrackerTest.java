package io.fleethive.controlplane.command;

import io.fleethive.fleet.model.Command;
import io.fleethive.fleet.model.CommandKind;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommandDeliveryTrackerTest {

    private final CommandDeliveryTracker tracker = new CommandDeliveryTracker();

    @Test
    void filtersAcknowledgedCommandsPerInstance() {
        Command a = command("agent-1");
        Command b = command("agent-1");
        tracker.acknowledge("agent-1", List.of(a.id()));

        assertThat(tracker.unacknowledged("agent-1", List.of(a, b))).containsExactly(b);
        assertThat(tracker.isAcknowledged("agent-1", a.id())).isTrue();
        assertThat(tracker.isAcknowledged("agent-2", a.id())).isFalse();
    }

    @Test
    void watermarkOnlyMovesForward() {
        Instant early = Instant.parse("2024-01-01T00:00:00Z");
        Instant late = early.plusSeconds(60);

        assertThat(tracker.watermark("agent-1")).isEmpty();
        tracker.advanceWatermark("agent-1", late);
        tracker.advanceWatermark("agent-1", early);

        assertThat(tracker.watermark("agent-1")).contains(late);
        assertThat(tracker.watermark("agent-2")).isEmpty();
        assertThat(tracker.watermark(null)).isEmpty();
    }

    private static Command command(String target) {
        return new Command(UUID.randomUUID(), CommandKind.RESTART, target, Map.of(), Instant.parse("2024-01-01T00:00:00Z"));
    }
}
