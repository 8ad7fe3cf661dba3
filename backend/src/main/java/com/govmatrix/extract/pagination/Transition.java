package com.govmatrix.extract.pagination;

public record Transition(
    PaginationState state,
    String cursor,
    int consecutiveFailures,
    boolean backoff,
    String reason
) {
}
