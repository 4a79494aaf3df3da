package io.zendesk.sdk.pagination;

import java.util.List;

/**
 * One page of an offset-paginated listing.
 */
public record OffsetPage<T>(List<T> items, Page page) {

    public OffsetPage {
        items = items == null ? List.of() : List.copyOf(items);
        page = page == null ? Page.EMPTY : page;
    }
}
