package com.talent.sourcing.lookup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.talent.sourcing.external.ExternalPermanentException;
import com.talent.sourcing.external.HttpJsonClient;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import com.talent.sourcing.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Company lookup and profile client for a search API that accepts Elasticsearch-style DSL
 * ({@code POST /v2/company_base/search/es_dsl/preview}) and serves full records
 * ({@code GET /v2/company_base/collect/{id}}).
 *
 * <pre>
 * HttpCompanyLookupClient client = HttpCompanyLookupClient.builder()
 *     .baseUrl("https://api.example-data.com")
 *     .apiKey(apiKey)
 *     .build();
 * </pre>
 */
public class HttpCompanyLookupClient implements CompanyLookupClient, ProfileClient {
    private static final Logger log = LoggerFactory.getLogger(HttpCompanyLookupClient.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final double DEFAULT_MIN_CONFIDENCE = 0.8;
    private static final int DEFAULT_MAX_HITS = 5;

    private final String baseUrl;
    private final String apiKey;
    private final double minConfidence;
    private final int maxHits;
    private final NameSimilarity similarity;
    private final HttpJsonClient http;
    private final ObjectMapper objectMapper;

    private HttpCompanyLookupClient(Builder builder) {
        if (builder.baseUrl == null || builder.baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1) : builder.baseUrl;
        this.apiKey = builder.apiKey;
        this.minConfidence = builder.minConfidence;
        this.maxHits = builder.maxHits;
        this.similarity = new NameSimilarity(builder.normalizer != null
                ? builder.normalizer : NameNormalizer.withDefaultRules());
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.http = new HttpJsonClient("company-lookup",
                builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT,
                objectMapper,
                builder.metrics != null ? builder.metrics : new NoOpMetricsService());
    }

    @Override
    public Optional<LookupMatch> lookup(LookupRequest request, LookupTier tier) {
        if (tier == LookupTier.WEBSITE && !request.hasWebsite()) {
            return Optional.empty();
        }
        ObjectNode body = buildQuery(request, tier);
        URI uri = URI.create(baseUrl + "/v2/company_base/search/es_dsl/preview");
        HttpJsonClient.JsonResponse response = http.postJson(uri, body, authHeaders());

        List<CompanyRecordParser.CompanyHit> hits = CompanyRecordParser.parseHits(response.body());
        Optional<LookupMatch> best = selectBest(request.name(), tier, hits);
        log.debug("lookup.tier name='{}' tier={} hits={} matched={}",
                request.name(), tier, hits.size(), best.isPresent());
        return best;
    }

    @Override
    public ProfilePayload fetchProfile(String stableId) {
        String encoded = URLEncoder.encode(stableId, StandardCharsets.UTF_8);
        URI uri = URI.create(baseUrl + "/v2/company_base/collect/" + encoded);
        HttpJsonClient.JsonResponse response = http.get(uri, authHeaders());
        if (!response.body().isObject()) {
            throw new ExternalPermanentException(http.getEndpoint(),
                    "Profile response for " + stableId + " is not an object", response.status());
        }
        return new ProfilePayload(stableId, response.body());
    }

    @Override
    public String endpointName() {
        return http.getEndpoint();
    }

    /**
     * Builds the search body for one tier, limited to {@code maxHits} results.
     */
    ObjectNode buildQuery(LookupRequest request, LookupTier tier) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("size", maxHits);
        ObjectNode query = root.putObject("query");
        switch (tier) {
            case EXACT_NAME -> query.putObject("match_phrase").put("name", request.name().strip());
            case WEBSITE -> query.putObject("match").put("website", domainOf(request.websiteHint()));
            case FUZZY_NAME -> query.putObject("match").putObject("name")
                    .put("query", request.name().strip())
                    .put("fuzziness", "AUTO");
        }
        return root;
    }

    Optional<LookupMatch> selectBest(String name, LookupTier tier, List<CompanyRecordParser.CompanyHit> hits) {
        return hits.stream()
                .map(hit -> new LookupMatch(hit.id(), hit.name(),
                        MatchConfidence.combine(similarity.compute(name, hit.name()), hit.score()),
                        tier, hit.metadata()))
                .filter(match -> match.confidence() >= minConfidence)
                .max(Comparator.comparingDouble(LookupMatch::confidence));
    }

    static String domainOf(String website) {
        String domain = website.toLowerCase(Locale.ROOT).strip()
                .replaceFirst("^[a-z]+://", "")
                .replaceFirst("^www\\.", "");
        int slash = domain.indexOf('/');
        return slash >= 0 ? domain.substring(0, slash) : domain;
    }

    private Map<String, String> authHeaders() {
        return apiKey == null || apiKey.isBlank() ? Map.of() : Map.of("apikey", apiKey);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiKey;
        private Duration timeout;
        private double minConfidence = DEFAULT_MIN_CONFIDENCE;
        private int maxHits = DEFAULT_MAX_HITS;
        private NameNormalizer normalizer;
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

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            if (minConfidence < 0.0 || minConfidence > 1.0) {
                throw new IllegalArgumentException("minConfidence must be between 0.0 and 1.0");
            }
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder maxHits(int maxHits) {
            if (maxHits < 1) {
                throw new IllegalArgumentException("maxHits must be >= 1");
            }
            this.maxHits = maxHits;
            return this;
        }

        public Builder normalizer(NameNormalizer normalizer) {
            this.normalizer = normalizer;
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

        public HttpCompanyLookupClient build() {
            return new HttpCompanyLookupClient(this);
        }
    }
}
