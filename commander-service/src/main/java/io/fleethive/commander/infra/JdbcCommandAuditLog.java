package io.fleethive.commander.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleethive.controlplane.command.CommandAuditLog;
import io.fleethive.controlplane.command.CommandKey;
import io.fleethive.controlplane.command.CommandRequests;
import io.fleethive.controlplane.command.CommandTimestamps;
import io.fleethive.controlplane.pagination.Cursor;
import io.fleethive.controlplane.pagination.Paginator;
import io.fleethive.fleet.error.AlreadyExistsException;
import io.fleethive.fleet.error.NotFoundException;
import io.fleethive.fleet.error.StorageException;
import io.fleethive.fleet.model.Command;
import io.fleethive.fleet.model.CommandKind;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

/**
 * PostgreSQL-backed {@link CommandAuditLog}. Rows are insert-only; the schema lives in
 * {@code db/migration}.
 * <p>
 * Listing uses keyset pagination on {@code (created_at, id)}, which matches {@link CommandKey} order:
 * PostgreSQL compares UUIDs bytewise, as the canonical hex strings compare.
 */
@Component
@ConditionalOnProperty(name = "fleethive.commander.storage.sink", havingValue = "postgres")
public class JdbcCommandAuditLog implements CommandAuditLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcCommandAuditLog.class);
    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
    };
    private static final String COLUMNS = "id, kind, target_instance_uid, data::text AS data, created_at";

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final CommandTimestamps timestamps;
    private final Paginator paginator;
    private final RowMapper<Command> rowMapper = this::mapRow;

    public JdbcCommandAuditLog(JdbcTemplate jdbc, ObjectMapper mapper, Clock clock, Paginator paginator) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.timestamps = new CommandTimestamps(Objects.requireNonNull(clock, "clock"));
        this.paginator = Objects.requireNonNull(paginator, "paginator");
        log.info("[CTRL] command audit log sink=postgres");
    }

    @Override
    public Command saveCommand(CommandKind kind, String targetInstanceUid, Map<String, Object> data) {
        CommandRequests.validate(kind, targetInstanceUid);
        Command command = new Command(UUID.randomUUID(), kind, targetInstanceUid, data, timestamps.next());
        try {
            jdbc.update(
                """
                    INSERT INTO command_log (id, kind, target_instance_uid, data, created_at)
                    VALUES (?, ?, ?, CAST(? AS JSONB), ?)
                    """,
                command.id(),
                kind.wireName(),
                targetInstanceUid,
                writeData(command.data()),
                OffsetDateTime.ofInstant(command.createdAt(), ZoneOffset.UTC));
        } catch (DuplicateKeyException e) {
            throw new AlreadyExistsException("command '%s' already exists".formatted(command.id()), e);
        } catch (DataAccessException e) {
            throw new StorageException("failed to store command " + command.id(), e);
        }
        log.info("[CTRL] command saved id={} kind={} target={}", command.id(), kind.wireName(), targetInstanceUid);
        return command;
    }

    @Override
    public Command getCommand(UUID id) {
        if (id == null) {
            throw NotFoundException.of("command", null);
        }
        List<Command> found = query("SELECT " + COLUMNS + " FROM command_log WHERE id = ?", id);
        if (found.isEmpty()) {
            throw NotFoundException.of("command", id);
        }
        return found.get(0);
    }

    @Override
    public List<Command> getCommandsByInstanceUid(String instanceUid) {
        if (instanceUid == null) {
            return List.of();
        }
        return query("SELECT " + COLUMNS + " FROM command_log WHERE target_instance_uid = ? ORDER BY created_at, id",
            instanceUid);
    }

    @Override
    public List<Command> getCommandsByInstanceUid(String instanceUid, Instant since) {
        if (instanceUid == null) {
            return List.of();
        }
        return query("SELECT " + COLUMNS + " FROM command_log WHERE target_instance_uid = ? AND created_at >= ?"
                + " ORDER BY created_at, id",
            instanceUid, OffsetDateTime.ofInstant(Objects.requireNonNull(since, "since"), ZoneOffset.UTC));
    }

    @Override
    public ListResponse<Command> listCommands(ListOptions options) {
        Optional<Cursor> cursor = paginator.cursor(options);
        int limit = paginator.resolveLimit(options, cursor);
        Optional<CommandKey> after = cursor.map(c -> CommandKey.parse(c.lastKey()));
        List<Command> items;
        long total;
        try {
            if (after.isPresent()) {
                OffsetDateTime createdAt = OffsetDateTime.ofInstant(after.get().createdAt(), ZoneOffset.UTC);
                UUID id = after.get().id();
                items = jdbc.query("SELECT " + COLUMNS + " FROM command_log WHERE (created_at, id) > (?, ?)"
                    + " ORDER BY created_at, id LIMIT ?", rowMapper, createdAt, id, limit);
                total = count("SELECT count(*) FROM command_log WHERE (created_at, id) > (?, ?)", createdAt, id);
            } else {
                items = jdbc.query("SELECT " + COLUMNS + " FROM command_log ORDER BY created_at, id LIMIT ?",
                    rowMapper, limit);
                total = count("SELECT count(*) FROM command_log");
            }
        } catch (DataAccessException e) {
            throw new StorageException("failed to list commands", e);
        }
        long remaining = Math.max(0, total - items.size());
        String next = remaining > 0 && !items.isEmpty()
            ? paginator.continueToken(CommandKey.of(items.get(items.size() - 1)).asString(), limit)
            : "";
        return new ListResponse<>(items, next, remaining);
    }

    private List<Command> query(String sql, Object... args) {
        try {
            return jdbc.query(sql, rowMapper, args);
        } catch (DataAccessException e) {
            throw new StorageException("failed to read commands", e);
        }
    }

    private long count(String sql, Object... args) {
        Long value = jdbc.queryForObject(sql, Long.class, args);
        return value == null ? 0 : value;
    }

    private Command mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Command(
            rs.getObject("id", UUID.class),
            CommandKind.fromWireName(rs.getString("kind")),
            rs.getString("target_instance_uid"),
            readData(rs.getString("data")),
            rs.getObject("created_at", OffsetDateTime.class).toInstant());
    }

    private String writeData(Map<String, Object> data) {
        try {
            return mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new StorageException("command data is not serializable", e);
        }
    }

    private Map<String, Object> readData(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, DATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("stored command data is unreadable", e);
        }
    }
}
