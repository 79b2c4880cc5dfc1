package io.fleethive.controlplane.pagination;

import io.fleethive.fleet.error.ValidationException;
import io.fleethive.fleet.model.ListOptions;
import io.fleethive.fleet.model.ListResponse;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;

/**
 * Pages a key-ordered collection using {@link ContinueTokenCodec} tokens.
 * <p>
 * The continue token records the key of the last returned item and the next page starts strictly
 * after it. For a collection that only grows at the end, following tokens therefore yields every item
 * exactly once and in order, and items appended between calls show up on later pages.
 */
public final class Paginator {

    public static final int DEFAULT_LIMIT = 100;
    public static final int DEFAULT_MAX_LIMIT = 1000;

    private final ContinueTokenCodec codec;
    private final int defaultLimit;
    private final int maxLimit;

    public Paginator(ContinueTokenCodec codec) {
        this(codec, DEFAULT_LIMIT, DEFAULT_MAX_LIMIT);
    }

    public Paginator(ContinueTokenCodec codec, int defaultLimit, int maxLimit) {
        this.codec = Objects.requireNonNull(codec, "codec");
        if (defaultLimit <= 0) {
            throw new IllegalArgumentException("defaultLimit must be > 0");
        }
        if (maxLimit < defaultLimit) {
            throw new IllegalArgumentException("maxLimit must be >= defaultLimit");
        }
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    public ContinueTokenCodec codec() {
        return codec;
    }

    /**
     * Decodes the continue token of {@code options}, if any.
     */
    public Optional<Cursor> cursor(ListOptions options) {
        if (options == null || !options.hasContinueToken()) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(options.continueToken()));
    }

    /**
     * Page size for a request: the explicit limit, else the one carried by the cursor, else the default.
     * Capped at the configured maximum.
     */
    public int resolveLimit(ListOptions options, Optional<Cursor> cursor) {
        int requested = options == null ? 0 : options.limit();
        if (requested < 0) {
            throw new ValidationException("limit must be >= 0");
        }
        if (requested == 0) {
            requested = cursor.map(Cursor::limit).filter(limit -> limit > 0).orElse(defaultLimit);
        }
        return Math.min(requested, maxLimit);
    }

    public String continueToken(String lastKey, int limit) {
        return codec.encode(lastKey, limit);
    }

    /**
     * Returns one page of {@code ordered}. The map may be a live concurrent view; it is iterated once.
     */
    public <T> ListResponse<T> page(NavigableMap<String, T> ordered, ListOptions options) {
        Objects.requireNonNull(ordered, "ordered");
        Optional<Cursor> cursor = cursor(options);
        int limit = resolveLimit(options, cursor);
        NavigableMap<String, T> remaining = cursor
            .map(c -> ordered.tailMap(c.lastKey(), false))
            .orElse(ordered);

        Iterator<Map.Entry<String, T>> iterator = remaining.entrySet().iterator();
        ArrayList<T> items = new ArrayList<>(Math.min(limit, 64));
        String lastKey = null;
        while (items.size() < limit && iterator.hasNext()) {
            Map.Entry<String, T> entry = iterator.next();
            items.add(entry.getValue());
            lastKey = entry.getKey();
        }
        long rest = 0;
        while (iterator.hasNext()) {
            iterator.next();
            rest++;
        }
        String next = rest > 0 && lastKey != null ? codec.encode(lastKey, limit) : "";
        return new ListResponse<>(items, next, rest);
    }
}
