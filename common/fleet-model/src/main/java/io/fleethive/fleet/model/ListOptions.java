package io.fleethive.fleet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request side of the list envelope shared by every listable resource.
 * <p>
 * A {@code limit} of zero (or less) means "no explicit limit": the page size then comes from the
 * continue token, or from the server default on the first page.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ListOptions(int limit, @JsonProperty("continue") String continueToken) {

    private static final ListOptions FIRST_PAGE = new ListOptions(0, null);

    public ListOptions {
        if (continueToken != null && continueToken.isBlank()) {
            continueToken = null;
        }
    }

    public static ListOptions firstPage() {
        return FIRST_PAGE;
    }

    public static ListOptions of(int limit) {
        return new ListOptions(limit, null);
    }

    public ListOptions next(String continueToken) {
        return new ListOptions(limit, continueToken);
    }

    public boolean hasContinueToken() {
        return continueToken != null;
    }
}
