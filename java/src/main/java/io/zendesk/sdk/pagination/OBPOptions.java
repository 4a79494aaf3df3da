package io.zendesk.sdk.pagination;

import io.zendesk.sdk.internal.QueryOptions;
import io.zendesk.sdk.internal.QueryString;

/**
 * Offset-based pagination request: paging inputs plus shared listing filters. Either part may be {@code null}.
 */
public record OBPOptions(PageOptions pageOptions, CommonOptions commonOptions) implements QueryOptions {

    @Override
    public void appendTo(QueryString query) {
        if (pageOptions != null) {
            pageOptions.appendTo(query);
        }
        if (commonOptions != null) {
            commonOptions.appendTo(query);
        }
    }
}
