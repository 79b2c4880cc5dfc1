package io.fleethive.fleet.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Response side of the list envelope: {@code {items, continue, remainingItemCount}}.
 * <p>
 * {@code continue} is the empty string once the listing is exhausted.
 */
public record ListResponse<T>(List<T> items,
                              @JsonProperty("continue") String continueToken,
                              long remainingItemCount) {

    public ListResponse {
        items = items == null ? List.of() : List.copyOf(items);
        continueToken = continueToken == null ? "" : continueToken;
        if (remainingItemCount < 0) {
            throw new IllegalArgumentException("remainingItemCount must be >= 0");
        }
    }

    public static <T> ListResponse<T> empty() {
        return new ListResponse<>(List.of(), "", 0);
    }

    public boolean hasMore() {
        return !continueToken.isEmpty();
    }

    public <R> ListResponse<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new ListResponse<>(mapped, continueToken, remainingItemCount);
    }
}
