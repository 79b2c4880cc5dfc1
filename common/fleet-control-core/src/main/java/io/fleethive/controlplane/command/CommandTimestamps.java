package io.fleethive.controlplane.command;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands out strictly increasing creation timestamps at microsecond precision.
 * <p>
 * When the clock stalls or steps back the next timestamp is the previous one plus a microsecond,
 * so the (createdAt, id) order matches issue order. Microseconds are what SQL timestamp columns keep.
 */
public final class CommandTimestamps {

    private final Clock clock;
    private final AtomicReference<Instant> last = new AtomicReference<>(Instant.EPOCH);

    public CommandTimestamps(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Instant next() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        return last.updateAndGet(previous -> now.isAfter(previous) ? now : previous.plus(1, ChronoUnit.MICROS));
    }
}
