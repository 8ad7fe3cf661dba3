package com.govmatrix.extract.service;

public enum ExtractionStatus {
    COMPLETED,
    PARTIAL,
    ABORTED,
    FAILED,
    NOT_FOUND
}
