package com.govmatrix.extract.pagination;

import com.govmatrix.extract.http.FetchError;
import com.govmatrix.extract.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Drives a {@link PageFetcher} through the pagination state machine until the cursor is exhausted
 * or the consecutive-failure bound is hit. Items are merged by identity, first occurrence wins.
 */
@Component
public class CursorPaginator {
    private static final Logger log = LoggerFactory.getLogger(CursorPaginator.class);

    private final Ticker ticker;

    public CursorPaginator(Ticker ticker) {
        this.ticker = ticker;
    }

    public <T> PaginationResult<T> paginate(
        String label,
        PageFetcher<T> fetcher,
        Function<T, String> identity,
        PaginationPolicy policy,
        ResumePoint<T> resume,
        PageListener<T> listener
    ) {
        Map<String, T> merged = new LinkedHashMap<>();
        ResumePoint<T> start = resume == null ? ResumePoint.fresh() : resume;
        for (T item : start.items()) {
            merged.putIfAbsent(identity.apply(item), item);
        }
        PageListener<T> checkpoint = listener == null ? PageListener.none() : listener;

        String cursor = start.cursor();
        int failures = 0;
        int pages = 0;
        int batchSize = policy.batchSize();
        long backoffMs = policy.backoffInitialMs();
        FetchError lastError = null;
        if (cursor != null || !merged.isEmpty()) {
            log.info("[{}] resuming with {} items from cursor {}", label, merged.size(), cursor);
        }

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                return interrupted(label, merged, cursor, pages, failures, lastError, checkpoint);
            }
            Page<T> page = fetcher.fetch(cursor, batchSize);
            if (page.isFailed()) {
                lastError = page.error();
                if (lastError.isInterrupted()) {
                    return interrupted(label, merged, cursor, pages, failures, lastError, checkpoint);
                }
            }

            int added = 0;
            for (T item : page.items()) {
                if (policy.maxItems() != null && merged.size() >= policy.maxItems()) {
                    break;
                }
                if (merged.putIfAbsent(identity.apply(item), item) == null) {
                    added++;
                }
            }

            Transition transition = PaginationTransitions.decide(policy, cursor, failures, pages, merged.size(), page);
            if (!page.isFailed() && !page.isEmpty()) {
                pages++;
            }
            failures = transition.consecutiveFailures();

            switch (transition.state()) {
                case ACCUMULATING -> {
                    cursor = transition.cursor();
                    backoffMs = policy.backoffInitialMs();
                    log.debug("[{}] page {}: +{} (total {})", label, pages, added, merged.size());
                    checkpoint.onCheckpoint(snapshot(merged), cursor);
                }
                case EXHAUSTED -> {
                    log.info("[{}] pagination complete: {} items in {} pages ({})", label, merged.size(), pages, transition.reason());
                    return new PaginationResult<>(snapshot(merged), null, PaginationOutcome.COMPLETED, pages, 0, lastError, transition.reason());
                }
                case FAILED -> {
                    cursor = transition.cursor();
                    checkpoint.onCheckpoint(snapshot(merged), cursor);
                    log.warn(
                        "[{}] pagination gave up after {} consecutive failures ({}); {} items kept, resume cursor {}",
                        label,
                        failures,
                        transition.reason(),
                        merged.size(),
                        cursor
                    );
                    return new PaginationResult<>(snapshot(merged), cursor, PaginationOutcome.FAILED, pages, failures, lastError, transition.reason());
                }
                case STALLED -> {
                    cursor = transition.cursor();
                    checkpoint.onCheckpoint(snapshot(merged), cursor);
                    if (policy.shrinkBatchEvery() > 0 && failures % policy.shrinkBatchEvery() == 0) {
                        batchSize = Math.max(policy.minBatchSize(), batchSize / 2);
                        log.warn("[{}] {} consecutive failures, batch size reduced to {}", label, failures, batchSize);
                    }
                    if (transition.backoff()) {
                        log.warn(
                            "[{}] stalled ({}), failure {}/{}; waiting {}ms",
                            label,
                            transition.reason(),
                            failures,
                            policy.maxConsecutiveFailures(),
                            backoffMs
                        );
                        if (!sleep(backoffMs)) {
                            return interrupted(label, merged, cursor, pages, failures, lastError, checkpoint);
                        }
                        backoffMs = Math.min(policy.backoffMaxMs(), Math.round(backoffMs * policy.backoffMultiplier()));
                    }
                }
                default -> throw new IllegalStateException("unexpected transition " + transition.state());
            }
        }
    }

    private <T> PaginationResult<T> interrupted(
        String label,
        Map<String, T> merged,
        String cursor,
        int pages,
        int failures,
        FetchError lastError,
        PageListener<T> checkpoint
    ) {
        List<T> items = snapshot(merged);
        checkpoint.onCheckpoint(items, cursor);
        log.warn("[{}] pagination interrupted with {} items, resume cursor {}", label, items.size(), cursor);
        return new PaginationResult<>(items, cursor, PaginationOutcome.INTERRUPTED, pages, failures, lastError, "interrupted");
    }

    private boolean sleep(long millis) {
        try {
            ticker.sleepMillis(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static <T> List<T> snapshot(Map<String, T> merged) {
        return new ArrayList<>(merged.values());
    }
}
