package com.govmatrix.extract.pagination;

import com.govmatrix.extract.http.FetchError;
import com.govmatrix.extract.http.FetchErrorType;
import com.govmatrix.extract.util.ManualTicker;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class CursorPaginatorTest {
    private final ManualTicker ticker = new ManualTicker();
    private final CursorPaginator paginator = new CursorPaginator(ticker);

    @Test
    void collectsEveryPageUntilCursorRunsOut() {
        ListServer server = new ListServer(items(7));
        List<Integer> checkpointSizes = new ArrayList<>();

        PaginationResult<String> result = paginator.paginate(
            "test",
            server,
            Function.identity(),
            PaginationPolicy.of(3, 3),
            ResumePoint.fresh(),
            (items, cursor) -> checkpointSizes.add(items.size())
        );

        assertThat(result.outcome()).isEqualTo(PaginationOutcome.COMPLETED);
        assertThat(result.items()).containsExactlyElementsOf(items(7));
        assertThat(result.resumeCursor()).isNull();
        assertThat(result.pagesFetched()).isEqualTo(3);
        assertThat(checkpointSizes).containsExactly(3, 6);
        assertThat(ticker.sleeps()).isEmpty();
    }

    @Test
    void resumingFromSavedCheckpointYieldsSameItemsAsUninterruptedRun() {
        PaginationPolicy policy = PaginationPolicy.of(4, 2);
        List<String> all = items(18);
        PaginationResult<String> uninterrupted = paginator.paginate(
            "full", new ListServer(all), Function.identity(), policy, ResumePoint.fresh(), PageListener.none());

        List<ResumePoint<String>> saved = new ArrayList<>();
        ListServer flaky = new ListServer(all);
        flaky.failAfter(2);
        PaginationResult<String> partial = paginator.paginate(
            "first", flaky, Function.identity(), policy, ResumePoint.fresh(),
            (items, cursor) -> saved.add(new ResumePoint<>(items, cursor)));

        assertThat(partial.outcome()).isEqualTo(PaginationOutcome.FAILED);
        assertThat(partial.items()).hasSize(8);
        assertThat(partial.resumeCursor()).isEqualTo("8");

        ResumePoint<String> lastSaved = saved.get(saved.size() - 1);
        // replaying the last completed page on resume must not duplicate anything
        ResumePoint<String> replayed = new ResumePoint<>(lastSaved.items(), "4");
        PaginationResult<String> resumed = paginator.paginate(
            "second", new ListServer(all), Function.identity(), policy, replayed, PageListener.none());

        assertThat(resumed.isComplete()).isTrue();
        assertThat(resumed.items()).containsExactlyElementsOf(uninterrupted.items());
    }

    @Test
    void identicalCursorTwiceTerminatesThroughFailureBound() {
        PageFetcher<String> stuck = (cursor, limit) -> Page.of(List.of("x-" + cursor), "same");

        PaginationResult<String> result = paginator.paginate(
            "stuck", stuck, Function.identity(), PaginationPolicy.of(10, 3), ResumePoint.fresh(), PageListener.none());

        assertThat(result.outcome()).isEqualTo(PaginationOutcome.FAILED);
        assertThat(result.reason()).isEqualTo("cursor_repeated");
        assertThat(result.resumeCursor()).isEqualTo("same");
        assertThat(result.consecutiveFailures()).isEqualTo(3);
        assertThat(result.items()).containsExactly("x-null", "x-same");
    }

    @Test
    void duplicatesAcrossPagesKeepFirstOccurrence() {
        List<Page<String>> pages = List.of(
            Page.of(List.of("a", "b"), "1"),
            Page.of(List.of("b", "c"), "2"),
            Page.of(List.of("a", "d"), null)
        );
        ScriptedFetcher fetcher = new ScriptedFetcher(pages);

        PaginationResult<String> result = paginator.paginate(
            "dup", fetcher, Function.identity(), PaginationPolicy.of(2, 3), ResumePoint.fresh(), PageListener.none());

        assertThat(result.items()).containsExactly("a", "b", "c", "d");
    }

    @Test
    void backoffGrowsGeometricallyAndIsCapped() {
        PageFetcher<String> down = (cursor, limit) -> Page.failed(FetchError.of(FetchErrorType.SERVER_ERROR, "503"));

        PaginationResult<String> result = paginator.paginate(
            "down", down, Function.identity(), PaginationPolicy.of(10, 5), ResumePoint.fresh(), PageListener.none());

        assertThat(result.outcome()).isEqualTo(PaginationOutcome.FAILED);
        assertThat(result.lastError().type()).isEqualTo(FetchErrorType.SERVER_ERROR);
        assertThat(ticker.sleeps()).containsExactly(2000L, 3400L, 5000L, 5000L);
    }

    @Test
    void batchShrinksAfterRepeatedFailures() {
        List<Integer> limits = new ArrayList<>();
        PageFetcher<String> down = (cursor, limit) -> {
            limits.add(limit);
            return Page.failed(FetchError.of(FetchErrorType.TIMEOUT, "timeout"));
        };
        PaginationPolicy policy = PaginationPolicy.of(400, 7).withBatchShrink(2, 100);

        paginator.paginate("shrink", down, Function.identity(), policy, ResumePoint.fresh(), PageListener.none());

        assertThat(limits).containsExactly(400, 400, 200, 200, 100, 100, 100);
    }

    @Test
    void interruptedFetchStopsWithResumableCursor() {
        List<Page<String>> pages = List.of(
            Page.of(List.of("a"), "1"),
            Page.failed(FetchError.of(FetchErrorType.INTERRUPTED, "stop"))
        );
        List<String> savedCursors = new ArrayList<>();

        PaginationResult<String> result = paginator.paginate(
            "stop", new ScriptedFetcher(pages), Function.identity(), PaginationPolicy.of(1, 5), ResumePoint.fresh(),
            (items, cursor) -> savedCursors.add(cursor));

        assertThat(result.outcome()).isEqualTo(PaginationOutcome.INTERRUPTED);
        assertThat(result.resumeCursor()).isEqualTo("1");
        assertThat(result.items()).containsExactly("a");
        assertThat(savedCursors).containsExactly("1", "1");
    }

    @Test
    void maxItemsTruncatesAccumulation() {
        PaginationResult<String> result = paginator.paginate(
            "cap", new ListServer(items(10)), Function.identity(), PaginationPolicy.of(4, 3).withMaxItems(6),
            ResumePoint.fresh(), PageListener.none());

        assertThat(result.isComplete()).isTrue();
        assertThat(result.items()).hasSize(6);
    }

    private static List<String> items(int count) {
        List<String> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add("item-" + i);
        }
        return items;
    }

    /**
     * Serves a fixed list; the cursor is the offset of the next item.
     */
    private static final class ListServer implements PageFetcher<String> {
        private final List<String> items;
        private int remainingSuccesses = Integer.MAX_VALUE;

        private ListServer(List<String> items) {
            this.items = items;
        }

        private void failAfter(int successes) {
            remainingSuccesses = successes;
        }

        @Override
        public Page<String> fetch(String afterCursor, int limit) {
            if (remainingSuccesses <= 0) {
                return Page.failed(FetchError.of(FetchErrorType.CONNECTION_ERROR, "down"));
            }
            remainingSuccesses--;
            int from = afterCursor == null ? 0 : Integer.parseInt(afterCursor);
            int to = Math.min(items.size(), from + limit);
            String next = to >= items.size() ? null : String.valueOf(to);
            return Page.of(items.subList(from, to), next);
        }
    }

    private static final class ScriptedFetcher implements PageFetcher<String> {
        private final List<Page<String>> pages;
        private int index;

        private ScriptedFetcher(List<Page<String>> pages) {
            this.pages = pages;
        }

        @Override
        public Page<String> fetch(String afterCursor, int limit) {
            return pages.get(Math.min(index++, pages.size() - 1));
        }
    }
}
