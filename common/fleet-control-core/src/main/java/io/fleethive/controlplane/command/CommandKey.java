package io.fleethive.controlplane.command;

import io.fleethive.fleet.error.InvalidCursorException;
import io.fleethive.fleet.model.Command;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Total order of the audit log: creation time, then the canonical (lower-case hex) id.
 * <p>
 * {@link #asString()} is fixed width, so comparing the strings compares the keys. The same string
 * is what continue tokens carry.
 */
public record CommandKey(Instant createdAt, UUID id) implements Comparable<CommandKey> {

    private static final Pattern FORMAT = Pattern.compile("^(\\d{19})(\\d{9}):([0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12})$");

    public CommandKey {
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(id, "id");
        if (createdAt.getEpochSecond() < 0) {
            throw new IllegalArgumentException("createdAt must not precede the epoch");
        }
    }

    public static CommandKey of(Command command) {
        return new CommandKey(command.createdAt(), command.id());
    }

    public static CommandKey parse(String value) {
        Matcher matcher = value == null ? null : FORMAT.matcher(value);
        if (matcher == null || !matcher.matches()) {
            throw new InvalidCursorException("continue token does not reference a command");
        }
        try {
            Instant createdAt = Instant.ofEpochSecond(Long.parseLong(matcher.group(1)), Long.parseLong(matcher.group(2)));
            return new CommandKey(createdAt, UUID.fromString(matcher.group(3)));
        } catch (RuntimeException e) {
            throw new InvalidCursorException("continue token does not reference a command", e);
        }
    }

    /**
     * A string that sorts before the key of every command created at or after {@code since}.
     */
    public static String lowerBound(Instant since) {
        Objects.requireNonNull(since, "since");
        if (since.getEpochSecond() < 0) {
            return "";
        }
        return "%019d%09d:".formatted(since.getEpochSecond(), since.getNano());
    }

    public String asString() {
        return "%019d%09d:%s".formatted(createdAt.getEpochSecond(), createdAt.getNano(), id);
    }

    @Override
    public int compareTo(CommandKey other) {
        return asString().compareTo(other.asString());
    }
}
