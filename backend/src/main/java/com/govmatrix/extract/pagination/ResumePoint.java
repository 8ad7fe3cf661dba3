package com.govmatrix.extract.pagination;

import java.util.List;

public record ResumePoint<T>(
    List<T> items,
    String cursor
) {
    public ResumePoint {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static <T> ResumePoint<T> fresh() {
        return new ResumePoint<>(List.of(), null);
    }
}
