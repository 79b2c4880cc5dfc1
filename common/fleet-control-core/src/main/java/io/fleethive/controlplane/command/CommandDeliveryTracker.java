package io.fleethive.controlplane.command;

import io.fleethive.fleet.model.Command;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which commands each agent instance acknowledged.
 * <p>
 * Kept apart from {@link CommandAuditLog} so that delivery bookkeeping never mutates audit records.
 * State is per instance id and therefore survives reconnects.
 * <p>
 * The per-instance watermark is a creation time before which every command of that instance is
 * acknowledged. Readers start their log query there instead of at the beginning of the history.
 */
public class CommandDeliveryTracker {

    private final Map<String, Set<UUID>> acknowledged = new ConcurrentHashMap<>();
    private final Map<String, Instant> watermarks = new ConcurrentHashMap<>();

    public void acknowledge(String instanceUid, Collection<UUID> commandIds) {
        if (instanceUid == null || commandIds == null || commandIds.isEmpty()) {
            return;
        }
        acknowledged.computeIfAbsent(instanceUid, ignored -> ConcurrentHashMap.newKeySet()).addAll(commandIds);
    }

    public boolean isAcknowledged(String instanceUid, UUID commandId) {
        Set<UUID> ids = instanceUid == null ? null : acknowledged.get(instanceUid);
        return ids != null && ids.contains(commandId);
    }

    /**
     * The subset of {@code commands} the instance has not acknowledged yet, order preserved.
     */
    public List<Command> unacknowledged(String instanceUid, List<Command> commands) {
        Set<UUID> ids = instanceUid == null ? null : acknowledged.get(instanceUid);
        if (ids == null || ids.isEmpty()) {
            return commands;
        }
        return commands.stream().filter(command -> !ids.contains(command.id())).toList();
    }

    public Optional<Instant> watermark(String instanceUid) {
        return instanceUid == null ? Optional.empty() : Optional.ofNullable(watermarks.get(instanceUid));
    }

    /**
     * Moves the watermark of {@code instanceUid} forward to {@code candidate}. Never moves it back.
     */
    public void advanceWatermark(String instanceUid, Instant candidate) {
        if (instanceUid == null || candidate == null) {
            return;
        }
        watermarks.merge(instanceUid, candidate, (current, next) -> next.isAfter(current) ? next : current);
    }
}
