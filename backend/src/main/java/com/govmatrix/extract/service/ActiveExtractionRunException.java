package com.govmatrix.extract.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveExtractionRunException extends RuntimeException {
    public ActiveExtractionRunException(String message) {
        super(message);
    }
}
