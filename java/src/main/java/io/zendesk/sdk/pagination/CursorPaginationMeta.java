package io.zendesk.sdk.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cursor pagination metadata found under the {@code meta} key of list responses.
 *
 * @param hasMore whether more results exist after this page
 * @param afterCursor cursor of the next result set
 * @param beforeCursor cursor of the previous result set
 */
public record CursorPaginationMeta(
    @JsonProperty("has_more") boolean hasMore,
    @JsonProperty("after_cursor") String afterCursor,
    @JsonProperty("before_cursor") String beforeCursor
) {

    public static final CursorPaginationMeta EMPTY = new CursorPaginationMeta(false, null, null);
}
