package io.zendesk.sdk.pagination;

/**
 * Options driving a {@link PageIterator}: page size, the pagination strategy to use and the filters to send with every
 * page request. Defaults to cursor pagination with 100 records per page.
 */
public final class PaginationOptions {

    public static final int DEFAULT_PAGE_SIZE = 100;

    private final int pageSize;
    private final boolean cursorBased;
    private final CommonOptions commonOptions;

    private PaginationOptions(Builder builder) {
        this.pageSize = builder.pageSize > 0 ? builder.pageSize : DEFAULT_PAGE_SIZE;
        this.cursorBased = builder.cursorBased;
        this.commonOptions = builder.commonOptions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PaginationOptions defaults() {
        return builder().build();
    }

    public int getPageSize() {
        return pageSize;
    }

    public boolean isCursorBased() {
        return cursorBased;
    }

    public CommonOptions getCommonOptions() {
        return commonOptions;
    }

    public static final class Builder {
        private int pageSize = DEFAULT_PAGE_SIZE;
        private boolean cursorBased = true;
        private CommonOptions commonOptions;

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder cursorBased(boolean cursorBased) {
            this.cursorBased = cursorBased;
            return this;
        }

        public Builder commonOptions(CommonOptions commonOptions) {
            this.commonOptions = commonOptions;
            return this;
        }

        public PaginationOptions build() {
            return new PaginationOptions(this);
        }
    }
}
