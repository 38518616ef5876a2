package com.talent.sourcing.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.talent.sourcing.external.EndpointThrottle;
import com.talent.sourcing.external.HttpJsonClient;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tavily search API client.
 *
 * <pre>
 * WebSearchClient search = TavilyWebSearchClient.builder()
 *     .apiKey(System.getenv("TAVILY_API_KEY"))
 *     .build();
 * </pre>
 */
public class TavilyWebSearchClient implements WebSearchClient {
    private static final Logger log = LoggerFactory.getLogger(TavilyWebSearchClient.class);

    private static final String DEFAULT_BASE_URL = "https://api.tavily.com";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);
    private static final String DEFAULT_SEARCH_DEPTH = "advanced";
    private static final int MAX_RESULTS_CAP = 20;

    private final String baseUrl;
    private final String apiKey;
    private final String searchDepth;
    private final EndpointThrottle throttle;
    private final ObjectMapper objectMapper;
    private final HttpJsonClient http;

    private TavilyWebSearchClient(Builder builder) {
        if (builder.apiKey == null || builder.apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey is required");
        }
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.apiKey = builder.apiKey;
        this.searchDepth = builder.searchDepth != null ? builder.searchDepth : DEFAULT_SEARCH_DEPTH;
        this.throttle = builder.throttle;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.http = new HttpJsonClient("web-search",
                builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT,
                objectMapper,
                builder.metrics != null ? builder.metrics : new NoOpMetricsService());
    }

    @Override
    public List<WebSearchHit> search(String query, int maxResults) {
        if (throttle != null) {
            throttle.acquire(http.getEndpoint());
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("api_key", apiKey);
        body.put("query", query);
        body.put("max_results", Math.max(1, Math.min(maxResults, MAX_RESULTS_CAP)));
        body.put("search_depth", searchDepth);
        body.put("include_answer", false);

        HttpJsonClient.JsonResponse response = http.postJson(URI.create(baseUrl + "/search"), body, Map.of());
        List<WebSearchHit> hits = parseResults(response.body());
        log.debug("webSearch.completed query='{}' hits={}", query, hits.size());
        return hits;
    }

    @Override
    public String endpointName() {
        return http.getEndpoint();
    }

    static List<WebSearchHit> parseResults(JsonNode root) {
        List<WebSearchHit> hits = new ArrayList<>();
        JsonNode results = root == null ? null : root.get("results");
        if (results == null || !results.isArray()) {
            return hits;
        }
        int rank = 0;
        for (JsonNode item : results) {
            hits.add(new WebSearchHit(text(item, "title"), text(item, "content"), text(item, "url"), rank++));
        }
        return hits;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private String searchDepth;
        private Duration timeout;
        private EndpointThrottle throttle;
        private ObjectMapper objectMapper;
        private MetricsService metrics;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder searchDepth(String searchDepth) {
            this.searchDepth = searchDepth;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Spaces consecutive calls to the search endpoint.
         */
        public Builder throttle(EndpointThrottle throttle) {
            this.throttle = throttle;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public TavilyWebSearchClient build() {
            return new TavilyWebSearchClient(this);
        }
    }
}
