package io.fleethive.controlplane.group;

import io.fleethive.fleet.error.ValidationException;
import java.util.regex.Pattern;

/**
 * Agent group names are DNS-label style: lower-case alphanumerics, '-' and '.', at most 63 characters,
 * starting and ending with an alphanumeric.
 */
public final class AgentGroupNames {

    public static final int MAX_LENGTH = 63;

    private static final Pattern VALID = Pattern.compile("[a-z0-9]([-a-z0-9.]*[a-z0-9])?");

    private AgentGroupNames() {
    }

    public static String requireValid(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("agent group name is required");
        }
        if (name.length() > MAX_LENGTH) {
            throw new ValidationException("agent group name must be at most " + MAX_LENGTH + " characters");
        }
        if (!VALID.matcher(name).matches()) {
            throw new ValidationException("agent group name '" + name + "' must match " + VALID.pattern());
        }
        return name;
    }
}
