package io.zendesk.sdk.pagination;

import io.zendesk.sdk.ZendeskException;

import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Lazy, forward-only walk over every page of a listing endpoint.
 *
 * <p>
 * Each call to {@link #nextPage()} issues exactly one request, advancing either the page index (offset pagination,
 * starting at page 1) or the opaque after-cursor returned by the previous response (cursor pagination). The walk ends
 * once a response reports no further pages. An iterator cannot be restarted; request a new one instead.
 * </p>
 *
 * <p>
 * Not thread-safe.
 * </p>
 *
 * @param <T> resource type yielded by the listing
 */
public final class PageIterator<T> {

    private static final Logger LOGGER = Logger.getLogger(PageIterator.class.getName());

    /**
     * Offset-paginated listing call.
     */
    @FunctionalInterface
    public interface OffsetLister<T> {
        OffsetPage<T> list(OBPOptions options) throws ZendeskException;
    }

    /**
     * Cursor-paginated listing call.
     */
    @FunctionalInterface
    public interface CursorLister<T> {
        CursorPage<T> list(CBPOptions options) throws ZendeskException;
    }

    private final int pageSize;
    private final boolean cursorBased;
    private final CommonOptions commonOptions;
    private final OffsetLister<T> offsetLister;
    private final CursorLister<T> cursorLister;

    private boolean hasMore = true;
    private String pageAfter;
    private int pageIndex = 1;

    public PageIterator(PaginationOptions options, OffsetLister<T> offsetLister, CursorLister<T> cursorLister) {
        PaginationOptions resolved = options == null ? PaginationOptions.defaults() : options;
        this.pageSize = resolved.getPageSize();
        this.cursorBased = resolved.isCursorBased();
        this.commonOptions = resolved.getCommonOptions();
        this.offsetLister = Objects.requireNonNull(offsetLister, "offsetLister");
        this.cursorLister = Objects.requireNonNull(cursorLister, "cursorLister");
    }

    /**
     * @return {@code true} until a response has reported that no further pages exist.
     */
    public boolean hasMore() {
        return hasMore;
    }

    /**
     * Fetches the next page.
     *
     * @throws NoSuchElementException when the listing is already exhausted
     * @throws ZendeskException when the page request fails; the iterator position is left unchanged
     */
    public List<T> nextPage() throws ZendeskException {
        if (!hasMore) {
            throw new NoSuchElementException("no more pages");
        }
        return cursorBased ? nextCursorPage() : nextOffsetPage();
    }

    /**
     * Fetches all remaining pages, handing each item to {@code action} in order.
     */
    public void forEachRemaining(Consumer<? super T> action) throws ZendeskException {
        Objects.requireNonNull(action, "action");
        while (hasMore) {
            for (T item : nextPage()) {
                action.accept(item);
            }
        }
    }

    private List<T> nextOffsetPage() throws ZendeskException {
        OBPOptions options = new OBPOptions(new PageOptions(pageSize, pageIndex), commonOptions);
        OffsetPage<T> result = offsetLister.list(options);
        int fetched = pageIndex;
        hasMore = result.page().hasNext();
        pageIndex++;
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[zendesk-sdk] offset page %d returned %d records (more: %s)", fetched, result.items().size(), hasMore));
        return result.items();
    }

    private List<T> nextCursorPage() throws ZendeskException {
        CBPOptions options = new CBPOptions(new CursorPagination(pageSize, pageAfter, null), commonOptions);
        CursorPage<T> result = cursorLister.list(options);
        CursorPaginationMeta meta = result.meta();
        String after = meta.afterCursor();
        if (meta.hasMore() && (after == null || after.isEmpty())) {
            LOGGER.warning("[zendesk-sdk] response reported more results without an after cursor; stopping");
            hasMore = false;
        } else if (meta.hasMore() && after.equals(pageAfter)) {
            LOGGER.warning("[zendesk-sdk] response repeated the previous after cursor; stopping");
            hasMore = false;
        } else {
            hasMore = meta.hasMore();
        }
        pageAfter = after;
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[zendesk-sdk] cursor page returned %d records (more: %s)", result.items().size(), hasMore));
        return result.items();
    }
}
