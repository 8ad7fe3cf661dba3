package com.govmatrix.extract.pagination;

/**
 * Pure transition function of the pagination state machine. No I/O, no clock.
 */
public final class PaginationTransitions {

    private PaginationTransitions() {}

    public static Transition decide(
        PaginationPolicy policy,
        String cursor,
        int consecutiveFailures,
        int pagesFetched,
        int accumulatedCount,
        Page<?> page
    ) {
        if (page.isFailed()) {
            return stall(policy, cursor, consecutiveFailures, true, "fetch_failed");
        }
        String next = page.nextCursor();
        boolean repeated = next != null && next.equals(cursor);

        if (!page.isEmpty()) {
            if (policy.maxItems() != null && accumulatedCount >= policy.maxItems()) {
                return exhausted("max_items_reached");
            }
            if (next == null) {
                return exhausted("no_next_cursor");
            }
            if (repeated) {
                if (expectedReached(policy, accumulatedCount)) {
                    return exhausted("cursor_repeated_expected_reached");
                }
                return stall(policy, cursor, consecutiveFailures, true, "cursor_repeated");
            }
            if (policy.maxPages() != null && pagesFetched + 1 >= policy.maxPages()) {
                return exhausted("max_pages_reached");
            }
            return new Transition(PaginationState.ACCUMULATING, next, 0, false, "page_accumulated");
        }

        if (next != null && !repeated) {
            return stall(policy, next, consecutiveFailures, false, "empty_page_cursor_advanced");
        }
        if (policy.expectedTotalKnown() && !expectedReached(policy, accumulatedCount)) {
            return stall(policy, cursor, consecutiveFailures, true, "empty_page_below_expected");
        }
        return exhausted("empty_page");
    }

    private static boolean expectedReached(PaginationPolicy policy, int accumulatedCount) {
        return policy.expectedTotalKnown() && accumulatedCount >= policy.expectedTotal();
    }

    private static Transition stall(
        PaginationPolicy policy,
        String cursor,
        int consecutiveFailures,
        boolean backoff,
        String reason
    ) {
        int failures = consecutiveFailures + 1;
        if (failures >= policy.maxConsecutiveFailures()) {
            return new Transition(PaginationState.FAILED, cursor, failures, false, reason);
        }
        return new Transition(PaginationState.STALLED, cursor, failures, backoff, reason);
    }

    private static Transition exhausted(String reason) {
        return new Transition(PaginationState.EXHAUSTED, null, 0, false, reason);
    }
}
