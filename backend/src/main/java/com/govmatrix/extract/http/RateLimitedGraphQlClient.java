package com.govmatrix.extract.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govmatrix.config.ExtractorProperties;
import com.govmatrix.extract.util.FetchErrorClassifier;
import com.govmatrix.extract.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class RateLimitedGraphQlClient {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedGraphQlClient.class);
    private static final int MAX_ERROR_SNIPPET = 200;

    private final ExtractorProperties properties;
    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final Ticker ticker;
    private final AdaptiveRateLimiter limiter;

    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong rateLimitCount = new AtomicLong();

    public RateLimitedGraphQlClient(
        ExtractorProperties properties,
        @Qualifier("graphQlHttpClient") HttpClient client,
        ObjectMapper objectMapper,
        Ticker ticker
    ) {
        this.properties = properties;
        this.client = client;
        this.objectMapper = objectMapper;
        this.ticker = ticker;
        ExtractorProperties.RateLimit rateLimit = properties.getRateLimit();
        this.limiter = new AdaptiveRateLimiter(
            ticker,
            rateLimit.getMinDelayMs(),
            rateLimit.getMaxDelayMs(),
            rateLimit.getRelaxFactor(),
            rateLimit.getTightenFactor()
        );
    }

    public GraphQlResult send(String query, Map<String, Object> variables) {
        Instant startedAt = Instant.now();
        requestCount.incrementAndGet();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("variables", variables == null ? Map.of() : variables);
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            errorCount.incrementAndGet();
            return failure(startedAt, 0, 0, FetchError.of(FetchErrorType.APPLICATION_ERROR, "request_serialization_failed"));
        }
        HttpRequest request = buildRequest(body);

        int maxAttempts = properties.getRateLimit().getMaxAttempts();
        FetchError lastError = null;
        int lastStatus = 0;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            boolean finalAttempt = attempt == maxAttempts - 1;
            try {
                limiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return failure(startedAt, 0, attempt, FetchError.of(FetchErrorType.INTERRUPTED, "interrupted while waiting for rate limit"));
            }

            HttpResponse<String> response;
            try {
                response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return failure(startedAt, 0, attempt + 1, FetchError.of(FetchErrorType.INTERRUPTED, e.getMessage()));
            } catch (IOException e) {
                errorCount.incrementAndGet();
                FetchErrorType type = FetchErrorClassifier.fromException(e);
                lastError = FetchError.of(type, e.getMessage());
                lastStatus = 0;
                log.warn("GraphQL transport error {} on attempt {}/{}: {}", type, attempt + 1, maxAttempts, e.getMessage());
                if (!finalAttempt && !sleep(linearBackoffMs(attempt))) {
                    return failure(startedAt, 0, attempt + 1, FetchError.of(FetchErrorType.INTERRUPTED, "interrupted during retry backoff"));
                }
                continue;
            }

            int status = response.statusCode();
            lastStatus = status;
            if (status == 200) {
                JsonNode root = parse(response.body());
                if (root == null) {
                    errorCount.incrementAndGet();
                    lastError = new FetchError(FetchErrorType.APPLICATION_ERROR, status, "unparseable response body");
                    log.warn("Unparseable GraphQL response on attempt {}/{}", attempt + 1, maxAttempts);
                    continue;
                }
                JsonNode errors = root.path("errors");
                if (hasErrors(errors)) {
                    errorCount.incrementAndGet();
                    lastError = new FetchError(FetchErrorType.APPLICATION_ERROR, status, snippet(errors.toString()));
                    log.warn("GraphQL errors on attempt {}/{}: {}", attempt + 1, maxAttempts, lastError.message());
                    continue;
                }
                JsonNode data = root.path("data");
                if (data.isMissingNode() || data.isNull()) {
                    errorCount.incrementAndGet();
                    lastError = new FetchError(FetchErrorType.APPLICATION_ERROR, status, "response without data");
                    log.warn("GraphQL response without data on attempt {}/{}", attempt + 1, maxAttempts);
                    continue;
                }
                limiter.relax();
                successCount.incrementAndGet();
                return new GraphQlResult(status, data, null, attempt + 1, Instant.now(), Duration.between(startedAt, Instant.now()));
            }

            FetchErrorType type = FetchErrorClassifier.fromHttpStatus(status);
            if (type == FetchErrorType.RATE_LIMITED) {
                rateLimitCount.incrementAndGet();
                limiter.tighten();
            } else {
                errorCount.incrementAndGet();
            }
            lastError = new FetchError(type, status, snippet(response.body()));
            if (!FetchErrorClassifier.isRetryable(type)) {
                log.warn("GraphQL request failed with non-retryable http_{}", status);
                return failure(startedAt, status, attempt + 1, lastError);
            }
            long backoffMs = exponentialBackoffMs(attempt);
            log.warn(
                "GraphQL http_{} on attempt {}/{}; backing off {}ms (delay now {}ms)",
                status,
                attempt + 1,
                maxAttempts,
                finalAttempt ? 0 : backoffMs,
                limiter.currentDelayMs()
            );
            if (!finalAttempt && !sleep(backoffMs)) {
                return failure(startedAt, status, attempt + 1, FetchError.of(FetchErrorType.INTERRUPTED, "interrupted during retry backoff"));
            }
        }

        log.warn("GraphQL request failed after {} attempts: {}", maxAttempts, lastError == null ? "unknown" : lastError.describe());
        return failure(startedAt, lastStatus, maxAttempts, lastError);
    }

    public ClientStats stats() {
        return new ClientStats(
            requestCount.get(),
            successCount.get(),
            errorCount.get(),
            rateLimitCount.get(),
            limiter.currentDelayMs()
        );
    }

    long exponentialBackoffMs(int attempt) {
        ExtractorProperties.RateLimit rateLimit = properties.getRateLimit();
        long delay = rateLimit.getRetryBaseDelayMs() * (1L << Math.min(20, Math.max(0, attempt)));
        return Math.min(delay, rateLimit.getRetryMaxDelayMs());
    }

    long linearBackoffMs(int attempt) {
        return properties.getRateLimit().getRetryBaseDelayMs() * (attempt + 1L);
    }

    private HttpRequest buildRequest(String body) {
        ExtractorProperties.Api api = properties.getApi();
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(api.getEndpoint()))
            .timeout(Duration.ofSeconds(api.getRequestTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("User-Agent", api.getUserAgent())
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (!api.getKey().isEmpty()) {
            builder.header("Api-Key", api.getKey());
        }
        return builder.build();
    }

    private boolean sleep(long millis) {
        try {
            ticker.sleepMillis(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private boolean hasErrors(JsonNode errors) {
        if (errors == null || errors.isMissingNode() || errors.isNull()) {
            return false;
        }
        return !errors.isArray() || errors.size() > 0;
    }

    private String snippet(String text) {
        if (text == null) {
            return null;
        }
        return text.length() <= MAX_ERROR_SNIPPET ? text : text.substring(0, MAX_ERROR_SNIPPET);
    }

    private GraphQlResult failure(Instant startedAt, int status, int attempts, FetchError error) {
        FetchError safeError = error == null
            ? FetchError.of(FetchErrorType.CONNECTION_ERROR, "no attempt completed")
            : error;
        return new GraphQlResult(status, null, safeError, attempts, Instant.now(), Duration.between(startedAt, Instant.now()));
    }
}
