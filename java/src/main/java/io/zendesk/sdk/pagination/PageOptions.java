package io.zendesk.sdk.pagination;

import io.zendesk.sdk.internal.QueryOptions;
import io.zendesk.sdk.internal.QueryString;

/**
 * Offset pagination inputs. Zero values are left out of the query so the API defaults apply.
 *
 * @param perPage number of records per page
 * @param page one-based page number
 */
public record PageOptions(int perPage, int page) implements QueryOptions {

    @Override
    public void appendTo(QueryString query) {
        query.add("per_page", perPage);
        query.add("page", page);
    }
}
