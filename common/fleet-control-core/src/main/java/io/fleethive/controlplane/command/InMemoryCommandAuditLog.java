package io.fleethive.controlplane.command;

import io.fleethive.controlplane.pagination.Paginator;
import io.fleethive.fleet.error.AlreadyExistsException;
import io.fleethive.fleet.error.NotFoundException;
import io.fleethive.fleet.model.Command;
import io.fleethive.fleet.model.CommandKind;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heap-backed {@link CommandAuditLog}.
 * <p>
 * Ids are claimed with {@code putIfAbsent}, so concurrent saves can neither overwrite each other nor
 * share an id. Ordered views are skip lists keyed by {@link CommandKey#asString()}; listings iterate
 * them without locking.
 */
public class InMemoryCommandAuditLog implements CommandAuditLog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCommandAuditLog.class);

    private final Map<UUID, Command> byId = new ConcurrentHashMap<>();
    private final NavigableMap<String, Command> ordered = new ConcurrentSkipListMap<>();
    private final Map<String, NavigableMap<String, Command>> byTarget = new ConcurrentHashMap<>();
    private final CommandTimestamps timestamps;
    private final Supplier<UUID> ids;
    private final Paginator paginator;

    public InMemoryCommandAuditLog(Clock clock, Paginator paginator) {
        this(clock, UUID::randomUUID, paginator);
    }

    public InMemoryCommandAuditLog(Clock clock, Supplier<UUID> ids, Paginator paginator) {
        this.timestamps = new CommandTimestamps(clock);
        this.ids = Objects.requireNonNull(ids, "ids");
        this.paginator = Objects.requireNonNull(paginator, "paginator");
    }

    @Override
    public Command saveCommand(CommandKind kind, String targetInstanceUid, Map<String, Object> data) {
        CommandRequests.validate(kind, targetInstanceUid);
        Command command = new Command(ids.get(), kind, targetInstanceUid, data, timestamps.next());
        if (byId.putIfAbsent(command.id(), command) != null) {
            throw AlreadyExistsException.of("command", command.id());
        }
        String key = CommandKey.of(command).asString();
        ordered.put(key, command);
        byTarget.computeIfAbsent(targetInstanceUid, ignored -> new ConcurrentSkipListMap<>()).put(key, command);
        log.info("[CTRL] command saved id={} kind={} target={}", command.id(), kind.wireName(), targetInstanceUid);
        return command;
    }

    @Override
    public Command getCommand(UUID id) {
        Command command = id == null ? null : byId.get(id);
        if (command == null) {
            throw NotFoundException.of("command", id);
        }
        return command;
    }

    @Override
    public List<Command> getCommandsByInstanceUid(String instanceUid) {
        NavigableMap<String, Command> commands = instanceUid == null ? null : byTarget.get(instanceUid);
        return commands == null ? List.of() : List.copyOf(commands.values());
    }

    @Override
    public List<Command> getCommandsByInstanceUid(String instanceUid, Instant since) {
        NavigableMap<String, Command> commands = instanceUid == null ? null : byTarget.get(instanceUid);
        if (commands == null) {
            return List.of();
        }
        return List.copyOf(commands.tailMap(CommandKey.lowerBound(since), true).values());
    }

    @Override
    public ListResponse<Command> listCommands(ListOptions options) {
        paginator.cursor(options).ifPresent(cursor -> CommandKey.parse(cursor.lastKey()));
        return paginator.page(ordered, options);
    }

    public int size() {
        return byId.size();
    }
}
