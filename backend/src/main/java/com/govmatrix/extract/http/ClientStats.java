package com.govmatrix.extract.http;

public record ClientStats(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    long rateLimitedRequests,
    long currentDelayMs
) {
    public double successRate() {
        return efficiency() * 100.0;
    }

    public double efficiency() {
        return successfulRequests / (double) Math.max(1L, totalRequests);
    }
}
