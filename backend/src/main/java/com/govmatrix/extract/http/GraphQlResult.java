package com.govmatrix.extract.http;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

public record GraphQlResult(
    int statusCode,
    JsonNode data,
    FetchError error,
    int attempts,
    Instant fetchedAt,
    Duration duration
) {
    public boolean isSuccessful() {
        return error == null && data != null && !data.isNull() && !data.isMissingNode();
    }
}
