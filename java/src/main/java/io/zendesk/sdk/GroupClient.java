package io.zendesk.sdk;

import io.zendesk.sdk.internal.Envelope;
import io.zendesk.sdk.internal.QueryString;
import io.zendesk.sdk.pagination.CBPOptions;
import io.zendesk.sdk.pagination.CursorPage;
import io.zendesk.sdk.pagination.OBPOptions;
import io.zendesk.sdk.pagination.OffsetPage;
import io.zendesk.sdk.pagination.PageIterator;
import io.zendesk.sdk.pagination.PaginationOptions;

import java.util.Locale;
import java.util.Objects;

/**
 * {@link GroupApi} backed by the shared request pipeline of a {@link ZendeskClient}.
 */
final class GroupClient implements GroupApi {

    private static final String GROUPS_PATH = "/groups.json";
    private static final String SINGLE = "group";
    private static final String PLURAL = "groups";

    private final ZendeskClient client;

    GroupClient(ZendeskClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public OffsetPage<Group> getGroups(GroupListOptions options) throws ZendeskException {
        byte[] body = client.get(QueryString.addOptions(GROUPS_PATH, options));
        return Envelope.offsetPage(body, PLURAL, Group.class);
    }

    @Override
    public OffsetPage<Group> getGroupsOBP(OBPOptions options) throws ZendeskException {
        byte[] body = client.get(QueryString.addOptions(GROUPS_PATH, options));
        return Envelope.offsetPage(body, PLURAL, Group.class);
    }

    @Override
    public CursorPage<Group> getGroupsCBP(CBPOptions options) throws ZendeskException {
        byte[] body = client.get(QueryString.addOptions(GROUPS_PATH, options));
        return Envelope.cursorPage(body, PLURAL, Group.class);
    }

    @Override
    public PageIterator<Group> getGroupsIterator(PaginationOptions options) {
        return new PageIterator<>(options, this::getGroupsOBP, this::getGroupsCBP);
    }

    @Override
    public Group getGroup(long groupId) throws ZendeskException {
        return Envelope.unwrap(client.get(groupPath(groupId)), SINGLE, Group.class);
    }

    @Override
    public Group createGroup(Group group) throws ZendeskException {
        Objects.requireNonNull(group, "group");
        byte[] body = client.post(GROUPS_PATH, Envelope.wrap(SINGLE, group));
        return Envelope.unwrap(body, SINGLE, Group.class);
    }

    @Override
    public Group updateGroup(long groupId, Group group) throws ZendeskException {
        Objects.requireNonNull(group, "group");
        byte[] body = client.put(groupPath(groupId), Envelope.wrap(SINGLE, group));
        return Envelope.unwrap(body, SINGLE, Group.class);
    }

    @Override
    public void deleteGroup(long groupId) throws ZendeskException {
        client.delete(groupPath(groupId));
    }

    private static String groupPath(long groupId) {
        return String.format(Locale.ROOT, "/groups/%d.json", groupId);
    }
}
