package com.govmatrix.extract.pagination;

import com.govmatrix.extract.http.FetchError;

import java.util.List;

public record Page<T>(
    List<T> items,
    String nextCursor,
    FetchError error
) {
    public Page {
        items = items == null ? List.of() : List.copyOf(items);
        nextCursor = nextCursor == null || nextCursor.isBlank() ? null : nextCursor;
    }

    public static <T> Page<T> of(List<T> items, String nextCursor) {
        return new Page<>(items, nextCursor, null);
    }

    public static <T> Page<T> failed(FetchError error) {
        return new Page<>(List.of(), null, error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
