package com.govmatrix.extract.util;

import com.govmatrix.extract.http.FetchErrorType;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;

public final class FetchErrorClassifier {

    private FetchErrorClassifier() {}

    public static FetchErrorType fromHttpStatus(int status) {
        if (status == 200) {
            return null;
        }
        if (status == 429) {
            return FetchErrorType.RATE_LIMITED;
        }
        if (status == 502 || status == 503 || status == 504) {
            return FetchErrorType.SERVER_ERROR;
        }
        return FetchErrorType.PERMANENT_HTTP_ERROR;
    }

    public static FetchErrorType fromException(Throwable error) {
        if (error instanceof InterruptedException) {
            return FetchErrorType.INTERRUPTED;
        }
        if (error instanceof HttpConnectTimeoutException) {
            return FetchErrorType.CONNECTION_ERROR;
        }
        if (error instanceof HttpTimeoutException) {
            return FetchErrorType.TIMEOUT;
        }
        if (error instanceof ConnectException || error instanceof UnknownHostException) {
            return FetchErrorType.CONNECTION_ERROR;
        }
        String message = error == null || error.getMessage() == null
            ? ""
            : error.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("timed out") || message.contains("timeout")) {
            return FetchErrorType.TIMEOUT;
        }
        return FetchErrorType.CONNECTION_ERROR;
    }

    public static boolean isRetryable(FetchErrorType type) {
        if (type == null) {
            return false;
        }
        return switch (type) {
            case TIMEOUT, CONNECTION_ERROR, RATE_LIMITED, SERVER_ERROR, APPLICATION_ERROR -> true;
            default -> false;
        };
    }
}
