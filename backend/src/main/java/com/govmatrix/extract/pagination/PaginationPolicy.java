package com.govmatrix.extract.pagination;

public record PaginationPolicy(
    int batchSize,
    int maxConsecutiveFailures,
    Integer maxItems,
    Integer maxPages,
    Integer expectedTotal,
    int shrinkBatchEvery,
    int minBatchSize,
    long backoffInitialMs,
    double backoffMultiplier,
    long backoffMaxMs
) {
    public PaginationPolicy {
        batchSize = Math.max(1, batchSize);
        maxConsecutiveFailures = Math.max(1, maxConsecutiveFailures);
        shrinkBatchEvery = Math.max(0, shrinkBatchEvery);
        minBatchSize = Math.max(1, Math.min(minBatchSize, batchSize));
        backoffInitialMs = Math.max(0, backoffInitialMs);
        backoffMultiplier = Math.max(1.0, backoffMultiplier);
        backoffMaxMs = Math.max(backoffInitialMs, backoffMaxMs);
    }

    public static PaginationPolicy of(int batchSize, int maxConsecutiveFailures) {
        return new PaginationPolicy(batchSize, maxConsecutiveFailures, null, null, null, 0, batchSize, 2000, 1.7, 5000);
    }

    public PaginationPolicy withMaxItems(Integer value) {
        return new PaginationPolicy(batchSize, maxConsecutiveFailures, value, maxPages, expectedTotal,
            shrinkBatchEvery, minBatchSize, backoffInitialMs, backoffMultiplier, backoffMaxMs);
    }

    public PaginationPolicy withMaxPages(Integer value) {
        return new PaginationPolicy(batchSize, maxConsecutiveFailures, maxItems, value, expectedTotal,
            shrinkBatchEvery, minBatchSize, backoffInitialMs, backoffMultiplier, backoffMaxMs);
    }

    public PaginationPolicy withExpectedTotal(Integer value) {
        return new PaginationPolicy(batchSize, maxConsecutiveFailures, maxItems, maxPages, value,
            shrinkBatchEvery, minBatchSize, backoffInitialMs, backoffMultiplier, backoffMaxMs);
    }

    public PaginationPolicy withBatchShrink(int every, int floor) {
        return new PaginationPolicy(batchSize, maxConsecutiveFailures, maxItems, maxPages, expectedTotal,
            every, floor, backoffInitialMs, backoffMultiplier, backoffMaxMs);
    }

    public PaginationPolicy withBackoff(long initialMs, double multiplier, long maxMs) {
        return new PaginationPolicy(batchSize, maxConsecutiveFailures, maxItems, maxPages, expectedTotal,
            shrinkBatchEvery, minBatchSize, initialMs, multiplier, maxMs);
    }

    boolean expectedTotalKnown() {
        return expectedTotal != null && expectedTotal > 0;
    }
}
