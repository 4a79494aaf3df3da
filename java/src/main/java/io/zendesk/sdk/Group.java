package io.zendesk.sdk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Agent group as exposed by the Support API.
 *
 * <p>
 * Server-assigned fields ({@code id}, {@code url}, timestamps) are left {@code null} when creating a group. Fields
 * other than {@code name} are dropped from request bodies when null, empty, zero or {@code false}, and a zero value
 * received for one of them is read back as {@code null} (not provided).
 * </p>
 *
 * @see <a href="https://developer.zendesk.com/api-reference/ticketing/groups/groups/">Groups API</a>
 */
public record Group(
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) Long id,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) String url,
    @JsonInclude(JsonInclude.Include.ALWAYS) String name,
    @JsonProperty("default") @JsonInclude(JsonInclude.Include.NON_DEFAULT) Boolean defaultGroup,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) Boolean deleted,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) String description,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public Group {
        id = id != null && id == 0L ? null : id;
        url = emptyToNull(url);
        defaultGroup = Boolean.FALSE.equals(defaultGroup) ? null : defaultGroup;
        deleted = Boolean.FALSE.equals(deleted) ? null : deleted;
        description = emptyToNull(description);
    }

    /**
     * Minimal group suitable for {@link GroupApi#createGroup(Group)}.
     */
    public static Group named(String name) {
        return new Group(null, null, name, null, null, null, null, null);
    }

    public Group withDescription(String description) {
        return new Group(id, url, name, defaultGroup, deleted, description, createdAt, updatedAt);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
