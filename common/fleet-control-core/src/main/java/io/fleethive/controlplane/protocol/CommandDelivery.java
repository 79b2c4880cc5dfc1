package io.fleethive.controlplane.protocol;

import io.fleethive.fleet.model.Command;
import io.fleethive.fleet.model.CommandKind;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record CommandDelivery(UUID id, CommandKind kind, Map<String, Object> data, Instant createdAt) {

    public static CommandDelivery from(Command command) {
        return new CommandDelivery(command.id(), command.kind(), command.data(), command.createdAt());
    }
}
