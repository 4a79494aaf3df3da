package io.zendesk.sdk.pagination;

import io.zendesk.sdk.ZendeskException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PageIteratorTest {

    private static final PageIterator.OffsetLister<String> NO_OFFSET = options -> {
        throw new AssertionError("offset pagination not expected");
    };

    @Test
    void stopsWhenMoreIsReportedWithoutCursor() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        PageIterator<String> iterator = new PageIterator<>(PaginationOptions.defaults(), NO_OFFSET, options -> {
            calls.incrementAndGet();
            return new CursorPage<>(List.of("a"), new CursorPaginationMeta(true, null, null));
        });

        List<String> items = new ArrayList<>();
        iterator.forEachRemaining(items::add);

        assertEquals(List.of("a"), items);
        assertEquals(1, calls.get());
    }

    @Test
    void stopsWhenCursorDoesNotAdvance() throws Exception {
        List<String> cursorsSeen = new ArrayList<>();
        PageIterator<String> iterator = new PageIterator<>(PaginationOptions.defaults(), NO_OFFSET, options -> {
            cursorsSeen.add(options.cursorPagination().pageAfter());
            return new CursorPage<>(List.of("p" + cursorsSeen.size()), new CursorPaginationMeta(true, "same", null));
        });

        List<String> items = new ArrayList<>();
        iterator.forEachRemaining(items::add);

        assertEquals(List.of("p1", "p2"), items);
        assertEquals(2, cursorsSeen.size());
        assertNull(cursorsSeen.get(0));
        assertEquals("same", cursorsSeen.get(1));
        assertFalse(iterator.hasMore());
    }

    @Test
    void failedPageCanBeRetriedFromSamePosition() throws Exception {
        List<String> cursorsSeen = new ArrayList<>();
        AtomicInteger calls = new AtomicInteger();
        PageIterator<String> iterator = new PageIterator<>(PaginationOptions.defaults(), NO_OFFSET, options -> {
            cursorsSeen.add(options.cursorPagination().pageAfter());
            int call = calls.incrementAndGet();
            if (call == 1) {
                return new CursorPage<>(List.of("a"), new CursorPaginationMeta(true, "c1", null));
            }
            if (call == 2) {
                throw new ZendeskException("boom");
            }
            return new CursorPage<>(List.of("b"), new CursorPaginationMeta(false, null, null));
        });

        assertEquals(List.of("a"), iterator.nextPage());
        assertThrows(ZendeskException.class, iterator::nextPage);
        assertTrue(iterator.hasMore());
        assertEquals(List.of("b"), iterator.nextPage());

        assertEquals(List.of("c1", "c1"), cursorsSeen.subList(1, 3));
        assertNull(cursorsSeen.get(0));
    }

    @Test
    void passesPageSizeAndFiltersToEveryRequest() throws Exception {
        CommonOptions filters = CommonOptions.builder().include("users").build();
        List<OBPOptions> seen = new ArrayList<>();
        PageIterator<String> iterator = new PageIterator<>(
            PaginationOptions.builder().cursorBased(false).pageSize(10).commonOptions(filters).build(),
            options -> {
                seen.add(options);
                String next = seen.size() < 2 ? "next" : null;
                return new OffsetPage<>(List.of("x"), new Page(null, next, 2));
            },
            options -> {
                throw new AssertionError("cursor pagination not expected");
            });

        iterator.forEachRemaining(item -> { });

        assertEquals(2, seen.size());
        assertEquals(new PageOptions(10, 1), seen.get(0).pageOptions());
        assertEquals(new PageOptions(10, 2), seen.get(1).pageOptions());
        assertSame(filters, seen.get(1).commonOptions());
    }

    @Test
    void nonPositivePageSizeFallsBackToDefault() {
        assertEquals(PaginationOptions.DEFAULT_PAGE_SIZE, PaginationOptions.builder().pageSize(0).build().getPageSize());
        assertTrue(PaginationOptions.defaults().isCursorBased());
    }
}
