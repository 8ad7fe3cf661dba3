package com.govmatrix.extract.service;

import com.govmatrix.extract.pagination.PaginationResult;

import java.util.List;
import java.util.Locale;

public record CollectionResult<T>(
    List<T> items,
    boolean complete,
    boolean fromCache,
    int pagesFetched,
    String failureReason
) {
    public CollectionResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static <T> CollectionResult<T> cached(List<T> items) {
        return new CollectionResult<>(items, true, true, 0, null);
    }

    public static <T> CollectionResult<T> from(PaginationResult<T> result) {
        if (result.isComplete()) {
            return new CollectionResult<>(result.items(), true, false, result.pagesFetched(), null);
        }
        String reason = result.outcome().name().toLowerCase(Locale.ROOT) + ":" + result.reason();
        if (result.lastError() != null) {
            reason = reason + " (" + result.lastError().describe() + ")";
        }
        return new CollectionResult<>(result.items(), false, false, result.pagesFetched(), reason);
    }
}
