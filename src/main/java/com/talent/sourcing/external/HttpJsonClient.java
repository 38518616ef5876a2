package com.talent.sourcing.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin JSON-over-HTTP helper shared by the third-party clients. Maps failures onto the
 * transient/permanent taxonomy: timeouts, I/O errors, 408, 429 and 5xx are transient,
 * every other non-2xx status is permanent.
 */
public class HttpJsonClient {
    private static final Logger log = LoggerFactory.getLogger(HttpJsonClient.class);

    private final String endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final MetricsService metrics;

    public HttpJsonClient(String endpoint, Duration timeout, ObjectMapper objectMapper, MetricsService metrics) {
        this(endpoint, HttpClient.newBuilder().connectTimeout(timeout).build(), timeout, objectMapper, metrics);
    }

    public HttpJsonClient(String endpoint, HttpClient httpClient, Duration timeout,
                          ObjectMapper objectMapper, MetricsService metrics) {
        this.endpoint = endpoint;
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    public String getEndpoint() {
        return endpoint;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * POSTs {@code body} serialized as JSON.
     */
    public JsonResponse postJson(URI uri, Object body, Map<String, String> headers) {
        String payload;
        try {
            payload = body instanceof String s ? s : objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ExternalPermanentException(endpoint, "Could not serialize request body", e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload));
        headers.forEach(builder::header);
        return send(builder.build());
    }

    public JsonResponse get(URI uri, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        headers.forEach(builder::header);
        return send(builder.build());
    }

    private JsonResponse send(HttpRequest request) {
        long start = System.nanoTime();
        String outcome = "error";
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            outcome = Integer.toString(response.statusCode());
            checkStatus(endpoint, response.statusCode(), response.body());
            JsonNode json = response.body() == null || response.body().isBlank()
                    ? objectMapper.nullNode()
                    : objectMapper.readTree(response.body());
            return new JsonResponse(response.statusCode(), json, response.headers().map());
        } catch (HttpTimeoutException e) {
            outcome = "timeout";
            throw new ExternalTransientException(endpoint, "Timed out after " + timeout.toMillis() + "ms", e);
        } catch (JsonProcessingException e) {
            throw new ExternalPermanentException(endpoint, "Malformed JSON response: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ExternalTransientException(endpoint, "I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalTransientException(endpoint, "Interrupted during call", e);
        } finally {
            metrics.recordExternalCall(endpoint, outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Throws the matching exception for a non-2xx status.
     */
    static void checkStatus(String endpoint, int status, String body) {
        if (status >= 200 && status < 300) {
            return;
        }
        String snippet = body == null ? "" : body.length() > 300 ? body.substring(0, 300) + "..." : body;
        if (status == 408 || status == 429 || status >= 500) {
            log.warn("external.transientStatus endpoint={} status={}", endpoint, status);
            throw new ExternalTransientException(endpoint, "HTTP " + status + ": " + snippet, status);
        }
        throw new ExternalPermanentException(endpoint, "HTTP " + status + ": " + snippet, status);
    }

    /**
     * A parsed response.
     */
    public record JsonResponse(int status, JsonNode body, Map<String, List<String>> headers) {

        public Optional<String> header(String name) {
            for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
                if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                    return Optional.of(entry.getValue().get(0));
                }
            }
            return Optional.empty();
        }
    }
}
