package com.govmatrix.extract.pagination;

import com.govmatrix.extract.http.FetchError;

import java.util.List;

public record PaginationResult<T>(
    List<T> items,
    String resumeCursor,
    PaginationOutcome outcome,
    int pagesFetched,
    int consecutiveFailures,
    FetchError lastError,
    String reason
) {
    public PaginationResult {
        items = List.copyOf(items);
    }

    public boolean isComplete() {
        return outcome == PaginationOutcome.COMPLETED;
    }
}
