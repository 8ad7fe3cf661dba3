package com.govmatrix.extract.pagination;

@FunctionalInterface
public interface PageFetcher<T> {

    Page<T> fetch(String afterCursor, int limit);
}
