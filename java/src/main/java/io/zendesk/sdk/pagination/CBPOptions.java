package io.zendesk.sdk.pagination;

import io.zendesk.sdk.internal.QueryOptions;
import io.zendesk.sdk.internal.QueryString;

/**
 * Cursor-based pagination request: cursor inputs plus shared listing filters. Either part may be {@code null}.
 */
public record CBPOptions(CursorPagination cursorPagination, CommonOptions commonOptions) implements QueryOptions {

    @Override
    public void appendTo(QueryString query) {
        if (cursorPagination != null) {
            cursorPagination.appendTo(query);
        }
        if (commonOptions != null) {
            commonOptions.appendTo(query);
        }
    }
}
