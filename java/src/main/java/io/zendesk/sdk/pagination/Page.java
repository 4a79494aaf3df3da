package io.zendesk.sdk.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Offset pagination metadata embedded at the root of list responses.
 *
 * @param previousPage URL of the previous page, {@code null} on the first page
 * @param nextPage URL of the next page, {@code null} on the last page
 * @param count total number of records across all pages
 */
public record Page(
    @JsonProperty("previous_page") String previousPage,
    @JsonProperty("next_page") String nextPage,
    @JsonProperty("count") long count
) {

    public static final Page EMPTY = new Page(null, null, 0);

    public boolean hasPrevious() {
        return previousPage != null;
    }

    public boolean hasNext() {
        return nextPage != null;
    }
}
