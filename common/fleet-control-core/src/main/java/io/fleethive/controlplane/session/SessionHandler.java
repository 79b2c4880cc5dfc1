package io.fleethive.controlplane.session;

import io.fleethive.controlplane.agent.AgentInventory;
import io.fleethive.controlplane.agent.AgentObservation;
import io.fleethive.controlplane.agent.InMemoryAgentInventory;
import io.fleethive.controlplane.command.CommandAuditLog;
import io.fleethive.controlplane.command.CommandDeliveryTracker;
import io.fleethive.controlplane.connection.ConnectionRegistry;
import io.fleethive.controlplane.connection.TransportType;
import io.fleethive.controlplane.group.AgentGroupStore;
import io.fleethive.controlplane.group.PrioritySelectorResolver;
import io.fleethive.controlplane.group.SelectorResolver;
import io.fleethive.controlplane.pagination.ContinueTokenCodec;
import io.fleethive.controlplane.pagination.Paginator;
import io.fleethive.controlplane.protocol.AgentDescription;
import io.fleethive.controlplane.protocol.AgentMessageCodec;
import io.fleethive.controlplane.protocol.AgentToServer;
import io.fleethive.controlplane.protocol.CommandDelivery;
import io.fleethive.controlplane.protocol.RemoteConfigOffer;
import io.fleethive.controlplane.protocol.ServerErrorResponse;
import io.fleethive.controlplane.protocol.ServerFlag;
import io.fleethive.controlplane.protocol.ServerToAgent;
import io.fleethive.fleet.error.AlreadyExistsException;
import io.fleethive.fleet.error.ProtocolException;
import io.fleethive.fleet.error.StorageException;
import io.fleethive.fleet.model.AgentGroup;
import io.fleethive.fleet.model.Command;
import io.fleethive.fleet.model.CommandKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Protocol state machine for agent sessions: {@code CONNECTED -> IDENTIFIED -> CLOSED}.
 * <p>
 * Transports call {@link #onConnect}, {@link #onMessage} and {@link #onClose} for each connection and
 * send back whatever reply {@link #onMessage} returns. Work for one connection is serialized on that
 * connection's session; different connections never contend.
 * <p>
 * Malformed messages and protocol violations do not close the connection. They are logged and
 * answered with a generic {@code BAD_REQUEST} error; storage failures are answered with
 * {@code UNAVAILABLE}.
 */
public final class SessionHandler {

    public static final int DEFAULT_MAX_COMMANDS_PER_REPLY = 16;
    public static final Duration DEFAULT_COMMAND_SETTLE_WINDOW = Duration.ofMinutes(1);

    private static final Logger log = LoggerFactory.getLogger(SessionHandler.class);

    private final ConnectionRegistry registry;
    private final CommandAuditLog commandLog;
    private final CommandDeliveryTracker deliveryTracker;
    private final AgentGroupStore groupStore;
    private final SelectorResolver resolver;
    private final AgentMessageCodec codec;
    private final AgentInventory inventory;
    private final Clock clock;
    private final int maxCommandsPerReply;
    private final Duration commandSettleWindow;
    private final Map<String, AgentSession> sessions = new ConcurrentHashMap<>();

    private SessionHandler(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.commandLog = Objects.requireNonNull(builder.commandLog, "commandLog");
        this.groupStore = Objects.requireNonNull(builder.groupStore, "groupStore");
        this.codec = Objects.requireNonNull(builder.codec, "codec");
        this.deliveryTracker = builder.deliveryTracker != null ? builder.deliveryTracker : new CommandDeliveryTracker();
        this.resolver = builder.resolver != null ? builder.resolver : new PrioritySelectorResolver();
        this.inventory = builder.inventory != null
            ? builder.inventory
            : new InMemoryAgentInventory(new Paginator(ContinueTokenCodec.withRandomKey()));
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        if (builder.maxCommandsPerReply < 1) {
            throw new IllegalArgumentException("maxCommandsPerReply must be >= 1");
        }
        this.maxCommandsPerReply = builder.maxCommandsPerReply;
        this.commandSettleWindow = builder.commandSettleWindow != null
            ? builder.commandSettleWindow
            : DEFAULT_COMMAND_SETTLE_WINDOW;
        if (commandSettleWindow.isNegative()) {
            throw new IllegalArgumentException("commandSettleWindow must not be negative");
        }
    }

    public void onConnect(String connectionId) {
        onConnect(connectionId, TransportType.UNKNOWN);
    }

    /**
     * Registers the connection and opens a session in state {@code CONNECTED}.
     * <p>
     * The session is published before the connection is registered and stays locked until
     * registration finished, so a caller that loses a connect race and then sends a message waits
     * for the winner instead of finding no session.
     *
     * @throws AlreadyExistsException if the id is already live
     */
    public void onConnect(String connectionId, TransportType transportType) {
        AgentSession session = new AgentSession(connectionId);
        synchronized (session) {
            if (sessions.putIfAbsent(connectionId, session) != null) {
                throw AlreadyExistsException.of("connection", connectionId);
            }
            try {
                registry.register(connectionId, transportType, clock.instant());
            } catch (RuntimeException e) {
                session.close();
                sessions.remove(connectionId, session);
                throw e;
            }
        }
        log.info("[OPAMP] connection opened id={} transport={}", connectionId, transportType);
    }

    /**
     * Handles one framed text message. Returns empty when nothing should be sent back: unknown or
     * closed connections and duplicate messages.
     */
    public Optional<ServerToAgent> onMessage(String connectionId, String payload) {
        AgentSession session = sessions.get(connectionId);
        if (session == null) {
            log.debug("[OPAMP] dropping message for unknown connection id={}", connectionId);
            return Optional.empty();
        }
        synchronized (session) {
            if (session.isClosed()) {
                return Optional.empty();
            }
            registry.touch(connectionId, clock.instant());
            AgentToServer message;
            try {
                message = codec.decode(payload);
            } catch (ProtocolException e) {
                log.warn("[OPAMP] malformed message on connection id={}: {}", connectionId, e.getMessage());
                return Optional.of(ServerToAgent.error(session.instanceUid(), ServerErrorResponse.badRequest()));
            }
            return handle(session, message);
        }
    }

    public Optional<ServerToAgent> onMessage(String connectionId, AgentToServer message) {
        AgentSession session = sessions.get(connectionId);
        if (session == null) {
            log.debug("[OPAMP] dropping message for unknown connection id={}", connectionId);
            return Optional.empty();
        }
        synchronized (session) {
            if (session.isClosed()) {
                return Optional.empty();
            }
            registry.touch(connectionId, clock.instant());
            if (message == null) {
                log.warn("[OPAMP] empty message on connection id={}", connectionId);
                return Optional.of(ServerToAgent.error(session.instanceUid(), ServerErrorResponse.badRequest()));
            }
            return handle(session, message);
        }
    }

    /**
     * Ends the session and removes the connection. Idempotent.
     */
    public void onClose(String connectionId) {
        AgentSession session = sessions.remove(connectionId);
        if (session != null) {
            synchronized (session) {
                session.close();
            }
            log.info("[OPAMP] connection closed id={} instance={}", connectionId, session.instanceUid());
        }
        registry.unregister(connectionId);
    }

    /**
     * Closes every session whose connection is no longer alive and returns their ids.
     */
    public List<String> closeStaleSessions() {
        List<String> stale = registry.staleConnections(clock.instant());
        for (String connectionId : stale) {
            log.info("[OPAMP] closing stale connection id={}", connectionId);
            onClose(connectionId);
        }
        return stale;
    }

    /**
     * Current state of a connection's session. Connections that are unknown or already gone report
     * {@link SessionState#CLOSED}.
     */
    public SessionState state(String connectionId) {
        AgentSession session = connectionId == null ? null : sessions.get(connectionId);
        if (session == null) {
            return SessionState.CLOSED;
        }
        synchronized (session) {
            return session.state();
        }
    }

    public Optional<String> effectiveGroup(String connectionId) {
        AgentSession session = connectionId == null ? null : sessions.get(connectionId);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            return Optional.ofNullable(session.effectiveGroup());
        }
    }

    public int activeSessions() {
        return sessions.size();
    }

    public AgentMessageCodec codec() {
        return codec;
    }

    private Optional<ServerToAgent> handle(AgentSession session, AgentToServer message) {
        try {
            return process(session, message);
        } catch (ProtocolException e) {
            log.warn("[OPAMP] protocol violation on connection id={}: {}", session.connectionId(), e.getMessage());
            return Optional.of(ServerToAgent.error(session.instanceUid(), ServerErrorResponse.badRequest()));
        } catch (StorageException e) {
            log.error("[OPAMP] storage failure while answering connection id={}", session.connectionId(), e);
            return Optional.of(ServerToAgent.error(session.instanceUid(), ServerErrorResponse.unavailable()));
        }
    }

    private Optional<ServerToAgent> process(AgentSession session, AgentToServer message) {
        Set<ServerFlag> flags = EnumSet.noneOf(ServerFlag.class);

        Long sequence = message.sequenceNum();
        if (sequence != null) {
            Long last = session.lastSequence();
            if (last != null && sequence.longValue() == last) {
                log.debug("[OPAMP] duplicate message seq={} on connection id={}", sequence, session.connectionId());
                return Optional.empty();
            }
            if (last != null && sequence < last) {
                log.info("[OPAMP] sequence went back {} -> {} on connection id={}, treating agent as restarted",
                    last, sequence, session.connectionId());
                session.restart(sequence);
                flags.add(ServerFlag.REPORT_FULL_STATE);
            } else {
                if (last != null && sequence > last + 1) {
                    log.info("[OPAMP] sequence gap {} -> {} on connection id={}, requesting full state",
                        last, sequence, session.connectionId());
                    flags.add(ServerFlag.REPORT_FULL_STATE);
                }
                session.lastSequence(sequence);
            }
        }

        AgentDescription description = message.agentDescription();
        String instanceUid = message.instanceUid();
        if (session.state() == SessionState.IDENTIFIED
            && instanceUid != null && !instanceUid.isBlank()
            && !instanceUid.equals(session.instanceUid())) {
            throw new ProtocolException("instance uid changed from '%s' to '%s'"
                .formatted(session.instanceUid(), instanceUid));
        }
        if (description != null) {
            if (instanceUid == null || instanceUid.isBlank()) {
                throw new ProtocolException("agent description without instance uid");
            }
            if (session.state() == SessionState.CONNECTED) {
                registry.bindInstance(session.connectionId(), instanceUid);
                session.identify(instanceUid);
                log.info("[OPAMP] connection id={} identified as instance={}", session.connectionId(), instanceUid);
            }
            session.identifyingAttributes(description.identifyingAttributes());
        } else if (session.state() == SessionState.CONNECTED) {
            flags.add(ServerFlag.REPORT_FULL_STATE);
            return Optional.of(new ServerToAgent(instanceUid, null, List.of(), flags, null));
        }

        String uid = session.instanceUid();
        recordAcknowledgements(uid, message.acknowledgedCommandIds());
        if (message.reportedConfigHash() != null) {
            session.reportedConfigHash(message.reportedConfigHash());
        }

        RemoteConfigOffer offer = resolveConfig(session);
        inventory.observe(new AgentObservation(
            uid,
            session.connectionId(),
            description == null ? null : description.identifyingAttributes(),
            description == null ? null : description.nonIdentifyingAttributes(),
            message.reportedConfigHash(),
            session.effectiveGroup(),
            clock.instant()));
        List<CommandDelivery> deliveries = pendingCommands(session);
        if (deliveries.stream().anyMatch(delivery -> delivery.kind() == CommandKind.REPORT_FULL_STATE)) {
            flags.add(ServerFlag.REPORT_FULL_STATE);
        }
        return Optional.of(new ServerToAgent(uid, offer, deliveries, flags, null));
    }

    private void recordAcknowledgements(String instanceUid, List<String> acknowledged) {
        if (acknowledged.isEmpty()) {
            return;
        }
        List<UUID> ids = new ArrayList<>(acknowledged.size());
        for (String raw : acknowledged) {
            try {
                ids.add(UUID.fromString(raw));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ProtocolException("invalid acknowledged command id '" + raw + "'", e);
            }
        }
        deliveryTracker.acknowledge(instanceUid, ids);
        log.debug("[OPAMP] instance={} acknowledged commands={}", instanceUid, ids);
    }

    private RemoteConfigOffer resolveConfig(AgentSession session) {
        Optional<AgentGroup.Active> group = resolver.resolve(session.identifyingAttributes(), groupStore.activeSnapshot());
        String groupName = group.map(AgentGroup.Active::name).orElse(null);
        if (!Objects.equals(groupName, session.effectiveGroup())) {
            log.info("[OPAMP] instance={} effective agent group {} -> {}",
                session.instanceUid(), session.effectiveGroup(), groupName);
            session.effectiveGroup(groupName);
        }
        return group
            .filter(active -> active.remoteConfig() != null)
            .filter(active -> !active.remoteConfig().hash().equals(session.reportedConfigHash()))
            .map(RemoteConfigOffer::from)
            .orElse(null);
    }

    private List<CommandDelivery> pendingCommands(AgentSession session) {
        String uid = session.instanceUid();
        Optional<Instant> watermark = deliveryTracker.watermark(uid);
        List<Command> history = watermark.isPresent()
            ? commandLog.getCommandsByInstanceUid(uid, watermark.get())
            : commandLog.getCommandsByInstanceUid(uid);
        List<Command> pending = deliveryTracker.unacknowledged(uid, history);
        advanceWatermark(uid, pending);
        List<CommandDelivery> deliveries = new ArrayList<>();
        for (Command command : pending) {
            if (deliveries.size() >= maxCommandsPerReply) {
                break;
            }
            if (session.wasDelivered(command.id())) {
                continue;
            }
            session.markDelivered(command.id());
            deliveries.add(CommandDelivery.from(command));
        }
        if (!deliveries.isEmpty()) {
            log.info("[OPAMP] delivering {} command(s) to instance={}", deliveries.size(), uid);
        }
        return deliveries;
    }

    /**
     * Everything before the oldest unacknowledged command is done. Commands newer than the settle
     * window may still be in flight to the log with an older timestamp, so the watermark never
     * passes {@code now - commandSettleWindow}.
     */
    private void advanceWatermark(String instanceUid, List<Command> pending) {
        Instant settled = clock.instant().minus(commandSettleWindow);
        Instant candidate = pending.isEmpty() ? settled : pending.get(0).createdAt();
        deliveryTracker.advanceWatermark(instanceUid, candidate.isBefore(settled) ? candidate : settled);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ConnectionRegistry registry;
        private CommandAuditLog commandLog;
        private CommandDeliveryTracker deliveryTracker;
        private AgentGroupStore groupStore;
        private SelectorResolver resolver;
        private AgentMessageCodec codec;
        private AgentInventory inventory;
        private Clock clock;
        private int maxCommandsPerReply = DEFAULT_MAX_COMMANDS_PER_REPLY;
        private Duration commandSettleWindow;

        private Builder() {
        }

        public Builder registry(ConnectionRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder commandLog(CommandAuditLog commandLog) {
            this.commandLog = commandLog;
            return this;
        }

        public Builder deliveryTracker(CommandDeliveryTracker deliveryTracker) {
            this.deliveryTracker = deliveryTracker;
            return this;
        }

        public Builder groupStore(AgentGroupStore groupStore) {
            this.groupStore = groupStore;
            return this;
        }

        public Builder resolver(SelectorResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder codec(AgentMessageCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder inventory(AgentInventory inventory) {
            this.inventory = inventory;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder maxCommandsPerReply(int maxCommandsPerReply) {
            this.maxCommandsPerReply = maxCommandsPerReply;
            return this;
        }

        public Builder commandSettleWindow(Duration commandSettleWindow) {
            this.commandSettleWindow = commandSettleWindow;
            return this;
        }

        public SessionHandler build() {
            return new SessionHandler(this);
        }
    }
}
