package com.govmatrix.extract.http;

public enum FetchErrorType {
    TIMEOUT,
    CONNECTION_ERROR,
    RATE_LIMITED,
    SERVER_ERROR,
    APPLICATION_ERROR,
    PERMANENT_HTTP_ERROR,
    INTERRUPTED
}
