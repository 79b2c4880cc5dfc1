package io.fleethive.controlplane.group;

import io.fleethive.controlplane.pagination.Paginator;
import io.fleethive.fleet.error.AlreadyExistsException;
import io.fleethive.fleet.error.NotFoundException;
import io.fleethive.fleet.error.ValidationException;
import io.fleethive.fleet.model.AgentGroup;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heap-backed {@link AgentGroupStore}.
 * <p>
 * Writes go through {@link ConcurrentHashMap#compute}, so changes to one name are serialized while
 * different names proceed in parallel. The active snapshot is rebuilt lazily after a write.
 */
public class InMemoryAgentGroupStore implements AgentGroupStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAgentGroupStore.class);

    private final Map<String, AgentGroup> groups = new ConcurrentHashMap<>();
    private final AtomicLong version = new AtomicLong();
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(new Snapshot(-1, List.of()));
    private final Clock clock;
    private final Paginator paginator;

    public InMemoryAgentGroupStore(Clock clock, Paginator paginator) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.paginator = Objects.requireNonNull(paginator, "paginator");
    }

    @Override
    public AgentGroup.Active create(String name, AgentGroupSpec spec, String actor) {
        AgentGroupNames.requireValid(name);
        Objects.requireNonNull(spec, "spec");
        AgentGroup.Active created = AgentGroup.Active.create(name, spec.priority(), spec.selector(),
            spec.attributes(), spec.remoteConfig(), clock.instant(), actor);
        if (groups.putIfAbsent(name, created) != null) {
            throw AlreadyExistsException.of("agent group", name);
        }
        version.incrementAndGet();
        log.info("[CTRL] agent group created name={} priority={} by={}", name, spec.priority(), created.createdBy());
        return created;
    }

    @Override
    public AgentGroup.Active update(String name, AgentGroupSpec spec, String actor) {
        Objects.requireNonNull(spec, "spec");
        AgentGroup result = groups.compute(name == null ? "" : name, (key, existing) -> {
            if (existing == null) {
                throw NotFoundException.of("agent group", key);
            }
            if (!(existing instanceof AgentGroup.Active active)) {
                throw new ValidationException("agent group '" + key + "' is deleted");
            }
            return active.update(spec.priority(), spec.selector(), spec.attributes(), spec.remoteConfig(),
                clock.instant(), actor);
        });
        version.incrementAndGet();
        log.info("[CTRL] agent group updated name={} priority={} by={}", name, spec.priority(), actor);
        return (AgentGroup.Active) result;
    }

    @Override
    public AgentGroup.Deleted delete(String name, String actor) {
        AgentGroup result = groups.compute(name == null ? "" : name, (key, existing) -> {
            if (existing == null) {
                throw NotFoundException.of("agent group", key);
            }
            if (existing instanceof AgentGroup.Active active) {
                return active.markDeleted(clock.instant(), actor);
            }
            return existing;
        });
        version.incrementAndGet();
        log.info("[CTRL] agent group deleted name={} by={}", name, actor);
        return (AgentGroup.Deleted) result;
    }

    @Override
    public AgentGroup get(String name) {
        AgentGroup group = name == null ? null : groups.get(name);
        if (group == null) {
            throw NotFoundException.of("agent group", name);
        }
        return group;
    }

    @Override
    public ListResponse<AgentGroup> list(ListOptions options, boolean includeDeleted) {
        NavigableMap<String, AgentGroup> ordered = new TreeMap<>();
        groups.forEach((name, group) -> {
            if (includeDeleted || !group.isDeleted()) {
                ordered.put(name, group);
            }
        });
        return paginator.page(ordered, options);
    }

    @Override
    public List<AgentGroup.Active> activeSnapshot() {
        long current = version.get();
        Snapshot cached = snapshot.get();
        if (cached.version() == current) {
            return cached.groups();
        }
        List<AgentGroup.Active> active = groups.values().stream()
            .filter(AgentGroup.Active.class::isInstance)
            .map(AgentGroup.Active.class::cast)
            .sorted(PrioritySelectorResolver.PRECEDENCE)
            .toList();
        snapshot.compareAndSet(cached, new Snapshot(current, active));
        return active;
    }

    private record Snapshot(long version, List<AgentGroup.Active> groups) {
    }
}
