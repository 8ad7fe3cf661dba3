package com.govmatrix.extract.pagination;

public enum PaginationState {
    START,
    FETCHING,
    ACCUMULATING,
    STALLED,
    EXHAUSTED,
    FAILED;

    public boolean isTerminal() {
        return this == EXHAUSTED || this == FAILED;
    }
}
