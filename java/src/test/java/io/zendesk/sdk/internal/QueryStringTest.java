package io.zendesk.sdk.internal;

import io.zendesk.sdk.pagination.CommonOptions;
import io.zendesk.sdk.pagination.OBPOptions;
import io.zendesk.sdk.pagination.PageOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryStringTest {

    @Test
    void skipsUnsetValues() {
        QueryString query = new QueryString()
            .add("name", "")
            .add("name", (String) null)
            .add("page", 0L)
            .add("active", false);

        assertTrue(query.isEmpty());
        assertEquals("", query.encode());
    }

    @Test
    void sortsKeysAndKeepsRepeatedValuesInOrder() {
        QueryString query = new QueryString()
            .addAll("role[]", List.of("agent", "admin"))
            .add("active", true)
            .add("include", "users,groups");

        assertEquals("active=true&include=users%2Cgroups&role%5B%5D=agent&role%5B%5D=admin", query.encode());
    }

    @Test
    void encodesSpacesAsPlus() {
        assertEquals("sort_by=created+at", new QueryString().add("sort_by", "created at").encode());
    }

    @Test
    void addOptionsLeavesPathAloneWhenNothingIsSet() {
        assertEquals("/groups.json", QueryString.addOptions("/groups.json", null));
        assertEquals("/groups.json", QueryString.addOptions("/groups.json", new PageOptions(0, 0)));
    }

    @Test
    void addOptionsCombinesPagingAndFilters() {
        OBPOptions options = new OBPOptions(
            new PageOptions(25, 3),
            CommonOptions.builder().sortBy("created_at").sortOrder("desc").permissionSet(7).build());

        assertEquals("/groups.json?page=3&per_page=25&permission_set=7&sort_by=created_at&sort_order=desc",
            QueryString.addOptions("/groups.json", options));
    }

    @Test
    void addOptionsExtendsExistingQuery() {
        assertEquals("/search.json?query=type%3Aticket&page=2",
            QueryString.addOptions("/search.json?query=type%3Aticket", new PageOptions(0, 2)));
    }
}
