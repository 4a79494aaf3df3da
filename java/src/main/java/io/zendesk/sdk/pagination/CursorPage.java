package io.zendesk.sdk.pagination;

import java.util.List;

/**
 * One page of a cursor-paginated listing.
 */
public record CursorPage<T>(List<T> items, CursorPaginationMeta meta) {

    public CursorPage {
        items = items == null ? List.of() : List.copyOf(items);
        meta = meta == null ? CursorPaginationMeta.EMPTY : meta;
    }
}
