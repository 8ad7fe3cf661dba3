package com.govmatrix.extract.pagination;

public enum PaginationOutcome {
    COMPLETED,
    FAILED,
    INTERRUPTED
}
