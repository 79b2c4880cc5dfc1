package io.fleethive.controlplane.command;

import io.fleethive.fleet.model.Command;
import io.fleethive.fleet.model.CommandKind;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only record of every command issued to an agent.
 * <p>
 * Stored commands are never modified or removed. Listings are ordered by creation time, then id.
 */
public interface CommandAuditLog {

    /**
     * Assigns an id and creation timestamp, persists the command and returns it.
     *
     * @throws io.fleethive.fleet.error.ValidationException for a missing kind or target
     * @throws io.fleethive.fleet.error.AlreadyExistsException if the generated id is already taken
     * @throws io.fleethive.fleet.error.StorageException if the backing store fails
     */
    Command saveCommand(CommandKind kind, String targetInstanceUid, Map<String, Object> data);

    /**
     * @throws io.fleethive.fleet.error.NotFoundException for an unknown id
     */
    Command getCommand(UUID id);

    /**
     * Every command issued to the instance, oldest first.
     */
    List<Command> getCommandsByInstanceUid(String instanceUid);

    /**
     * Commands issued to the instance created at or after {@code since}, oldest first.
     */
    List<Command> getCommandsByInstanceUid(String instanceUid, Instant since);

    ListResponse<Command> listCommands(ListOptions options);
}
