package com.govmatrix.extract.http;

import java.util.Locale;

public record FetchError(
    FetchErrorType type,
    int statusCode,
    String message
) {
    public static FetchError of(FetchErrorType type, String message) {
        return new FetchError(type, 0, message);
    }

    public boolean isInterrupted() {
        return type == FetchErrorType.INTERRUPTED;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder(type.name().toLowerCase(Locale.ROOT));
        if (statusCode > 0) {
            sb.append(" http_").append(statusCode);
        }
        if (message != null && !message.isBlank()) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }
}
