package com.govmatrix.extract.pagination;

import java.util.List;

@FunctionalInterface
public interface PageListener<T> {

    PageListener<Object> NONE = (items, cursor) -> { };

    void onCheckpoint(List<T> accumulated, String resumeCursor);

    @SuppressWarnings("unchecked")
    static <T> PageListener<T> none() {
        return (PageListener<T>) NONE;
    }
}
