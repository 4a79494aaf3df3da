package io.zendesk.sdk.pagination;

import io.zendesk.sdk.internal.QueryOptions;
import io.zendesk.sdk.internal.QueryString;

import java.util.List;

/**
 * Listing filters shared by offset and cursor pagination. Unset values are omitted from the query string.
 */
public final class CommonOptions implements QueryOptions {

    private final boolean active;
    private final String role;
    private final List<String> roles;
    private final long permissionSet;
    private final String sortBy;
    private final String sortOrder;
    private final String sort;
    private final String include;

    private CommonOptions(Builder builder) {
        this.active = builder.active;
        this.role = builder.role;
        this.roles = builder.roles == null ? List.of() : List.copyOf(builder.roles);
        this.permissionSet = builder.permissionSet;
        this.sortBy = builder.sortBy;
        this.sortOrder = builder.sortOrder;
        this.sort = builder.sort;
        this.include = builder.include;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void appendTo(QueryString query) {
        query.add("active", active);
        query.add("role", role);
        query.addAll("role[]", roles);
        query.add("permission_set", permissionSet);
        query.add("sort_by", sortBy);
        query.add("sort_order", sortOrder);
        query.add("sort", sort);
        query.add("include", include);
    }

    public boolean isActive() {
        return active;
    }

    public String getRole() {
        return role;
    }

    public List<String> getRoles() {
        return roles;
    }

    public long getPermissionSet() {
        return permissionSet;
    }

    public String getSortBy() {
        return sortBy;
    }

    public String getSortOrder() {
        return sortOrder;
    }

    public String getSort() {
        return sort;
    }

    public String getInclude() {
        return include;
    }

    public static final class Builder {
        private boolean active;
        private String role;
        private List<String> roles;
        private long permissionSet;
        private String sortBy;
        private String sortOrder;
        private String sort;
        private String include;

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder roles(List<String> roles) {
            this.roles = roles;
            return this;
        }

        public Builder permissionSet(long permissionSet) {
            this.permissionSet = permissionSet;
            return this;
        }

        /**
         * Offset pagination sort field, for example {@code created_at} or {@code updated_at}.
         */
        public Builder sortBy(String sortBy) {
            this.sortBy = sortBy;
            return this;
        }

        /**
         * {@code asc} or {@code desc}; offset pagination only.
         */
        public Builder sortOrder(String sortOrder) {
            this.sortOrder = sortOrder;
            return this;
        }

        /**
         * Cursor pagination sort, a field name optionally prefixed with {@code -} for descending order.
         */
        public Builder sort(String sort) {
            this.sort = sort;
            return this;
        }

        /**
         * Comma-separated list of sideloads.
         */
        public Builder include(String include) {
            this.include = include;
            return this;
        }

        public CommonOptions build() {
            return new CommonOptions(this);
        }
    }
}
