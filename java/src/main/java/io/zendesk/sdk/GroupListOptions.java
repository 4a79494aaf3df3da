package io.zendesk.sdk;

import io.zendesk.sdk.internal.QueryOptions;
import io.zendesk.sdk.internal.QueryString;
import io.zendesk.sdk.pagination.PageOptions;

/**
 * Options for {@link GroupApi#getGroups(GroupListOptions)}.
 */
public record GroupListOptions(PageOptions pageOptions) implements QueryOptions {

    @Override
    public void appendTo(QueryString query) {
        if (pageOptions != null) {
            pageOptions.appendTo(query);
        }
    }
}
