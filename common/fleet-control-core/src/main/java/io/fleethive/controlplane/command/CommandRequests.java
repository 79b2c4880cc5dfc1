package io.fleethive.controlplane.command;

import io.fleethive.fleet.error.ValidationException;
import io.fleethive.fleet.model.CommandKind;

/**
 * Argument checks shared by {@link CommandAuditLog} implementations.
 */
public final class CommandRequests {

    private static final int MAX_INSTANCE_UID_LENGTH = 256;

    private CommandRequests() {
    }

    public static void validate(CommandKind kind, String targetInstanceUid) {
        if (kind == null) {
            throw new ValidationException("command kind is required");
        }
        if (targetInstanceUid == null || targetInstanceUid.isBlank()) {
            throw new ValidationException("targetInstanceUid is required");
        }
        if (targetInstanceUid.length() > MAX_INSTANCE_UID_LENGTH) {
            throw new ValidationException("targetInstanceUid must be at most " + MAX_INSTANCE_UID_LENGTH + " characters");
        }
    }
}
