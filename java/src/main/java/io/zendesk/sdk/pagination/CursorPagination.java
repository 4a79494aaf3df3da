package io.zendesk.sdk.pagination;

import io.zendesk.sdk.internal.QueryOptions;
import io.zendesk.sdk.internal.QueryString;

/**
 * Cursor pagination inputs. Cursor pagination is preferred where the endpoint supports it.
 *
 * <p>
 * Cursors are opaque tokens issued by the server; they are passed back verbatim and never built or inspected here.
 * </p>
 *
 * @param pageSize number of results per page; most endpoints accept up to 100
 * @param pageAfter the "next" cursor, taken from {@link CursorPaginationMeta#afterCursor()}
 * @param pageBefore the "previous" cursor, taken from {@link CursorPaginationMeta#beforeCursor()}
 */
public record CursorPagination(int pageSize, String pageAfter, String pageBefore) implements QueryOptions {

    public static CursorPagination ofSize(int pageSize) {
        return new CursorPagination(pageSize, null, null);
    }

    public CursorPagination after(String cursor) {
        return new CursorPagination(pageSize, cursor, null);
    }

    public CursorPagination before(String cursor) {
        return new CursorPagination(pageSize, null, cursor);
    }

    @Override
    public void appendTo(QueryString query) {
        query.add("page[size]", pageSize);
        query.add("page[after]", pageAfter);
        query.add("page[before]", pageBefore);
    }
}
