package io.zendesk.sdk;

import io.zendesk.sdk.pagination.CBPOptions;
import io.zendesk.sdk.pagination.CursorPage;
import io.zendesk.sdk.pagination.OBPOptions;
import io.zendesk.sdk.pagination.OffsetPage;
import io.zendesk.sdk.pagination.PageIterator;
import io.zendesk.sdk.pagination.PaginationOptions;

/**
 * Operations on agent groups.
 *
 * @see <a href="https://developer.zendesk.com/api-reference/ticketing/groups/groups/">Groups API</a>
 */
public interface GroupApi {

    /**
     * Lists groups with offset pagination. {@code options} may be {@code null}.
     */
    OffsetPage<Group> getGroups(GroupListOptions options) throws ZendeskException;

    OffsetPage<Group> getGroupsOBP(OBPOptions options) throws ZendeskException;

    CursorPage<Group> getGroupsCBP(CBPOptions options) throws ZendeskException;

    /**
     * Walks every group page by page. No request is sent until the first page is requested.
     */
    PageIterator<Group> getGroupsIterator(PaginationOptions options);

    Group getGroup(long groupId) throws ZendeskException;

    Group createGroup(Group group) throws ZendeskException;

    Group updateGroup(long groupId, Group group) throws ZendeskException;

    void deleteGroup(long groupId) throws ZendeskException;
}
