package io.fleethive.commander.app;

/**
 * Identifies who performed an admin operation, for the audit fields of agent groups.
 */
public final class ActingUser {

    public static final String HEADER = "X-Fleet-User";
    public static final String ANONYMOUS = "anonymous";

    private ActingUser() {
    }

    public static String resolve(String header) {
        if (header == null || header.isBlank()) {
            return ANONYMOUS;
        }
        return header.trim();
    }
}
