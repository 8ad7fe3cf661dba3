package com.govmatrix.extract.service;

public class ExtractionAbortedException extends RuntimeException {
    public ExtractionAbortedException(String message) {
        super(message);
    }
}
