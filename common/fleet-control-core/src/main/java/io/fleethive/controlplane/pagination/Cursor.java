package io.fleethive.controlplane.pagination;

import java.util.Objects;

/**
 * Decoded continue token: the key of the last item already returned and the page size in use.
 */
public record Cursor(String lastKey, int limit) {

    public Cursor {
        Objects.requireNonNull(lastKey, "lastKey");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
    }
}
