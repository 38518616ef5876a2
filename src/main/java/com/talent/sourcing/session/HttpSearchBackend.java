package com.talent.sourcing.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.talent.sourcing.external.HttpJsonClient;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.query.QueryTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Person search over an Elasticsearch-style DSL preview endpoint
 * ({@code POST /v2/employee_base/search/es_dsl/preview?page=N}).
 * The total hit estimate is read from the {@code X-Total-Count} response header.
 * The endpoint serves a fixed page length, so the requested page size is not sent and every
 * item of a page is returned; the session buffers what the caller has not asked for yet.
 */
public class HttpSearchBackend implements SearchBackend {
    private static final Logger log = LoggerFactory.getLogger(HttpSearchBackend.class);

    static final String TOTAL_COUNT_HEADER = "X-Total-Count";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final String apiKey;
    private final HttpJsonClient http;

    private HttpSearchBackend(Builder builder) {
        if (builder.baseUrl == null || builder.baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1) : builder.baseUrl;
        this.apiKey = builder.apiKey;
        Duration timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.http = new HttpJsonClient("person-search",
                builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder().connectTimeout(timeout).build(),
                timeout,
                builder.objectMapper != null ? builder.objectMapper : new ObjectMapper(),
                builder.metrics != null ? builder.metrics : new NoOpMetricsService());
    }

    @Override
    public SearchPage fetchPage(QueryTree query, int page, int pageSize) {
        URI uri = URI.create(baseUrl + "/v2/employee_base/search/es_dsl/preview?page=" + page);
        Map<String, String> headers = apiKey != null ? Map.of("apikey", apiKey) : Map.of();
        HttpJsonClient.JsonResponse response = http.postJson(uri, query.toJson(), headers);

        JsonNode items = resultArray(response.body());
        List<PersonRecord> records = parseRecords(items);
        long total = parseTotal(response.header(TOTAL_COUNT_HEADER).orElse(null));
        log.debug("personSearch.page page={} items={} records={} total={}",
                page, items.size(), records.size(), total);
        return new SearchPage(records, total, items.size());
    }

    @Override
    public String endpointName() {
        return http.getEndpoint();
    }

    /**
     * Reads records from a bare array or from a {@code results} / {@code data} array.
     * Records without an {@code id} or {@code _id} are skipped.
     */
    static List<PersonRecord> parseRecords(JsonNode body) {
        List<PersonRecord> records = new ArrayList<>();
        for (JsonNode item : resultArray(body)) {
            String id = recordId(item);
            if (id == null) {
                log.debug("personSearch.recordWithoutId skipped");
                continue;
            }
            records.add(new PersonRecord(id, item));
        }
        return records;
    }

    /**
     * The item array of a response body; empty when the body has none.
     */
    static JsonNode resultArray(JsonNode body) {
        JsonNode array = body;
        if (body != null && body.isObject()) {
            array = body.has("results") ? body.get("results") : body.get("data");
        }
        return array != null && array.isArray() ? array : JsonNodeFactory.instance.arrayNode();
    }

    static long parseTotal(String header) {
        if (header == null || header.isBlank()) {
            return SearchPage.UNKNOWN_TOTAL;
        }
        try {
            long total = Long.parseLong(header.strip());
            return total >= 0 ? total : SearchPage.UNKNOWN_TOTAL;
        } catch (NumberFormatException e) {
            log.debug("personSearch.badTotalHeader value='{}'", header);
            return SearchPage.UNKNOWN_TOTAL;
        }
    }

    private static String recordId(JsonNode item) {
        if (item == null || !item.isObject()) {
            return null;
        }
        JsonNode id = item.hasNonNull("id") ? item.get("id") : item.get("_id");
        if (id == null || id.isNull()) {
            return null;
        }
        String text = id.asText();
        return text.isBlank() ? null : text;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration timeout;
        private ObjectMapper objectMapper;
        private MetricsService metrics;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
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

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public HttpSearchBackend build() {
            return new HttpSearchBackend(this);
        }
    }
}
