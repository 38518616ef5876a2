package com.talent.sourcing.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.talent.sourcing.core.model.Entity;
import com.talent.sourcing.core.model.EntityMetadata;
import com.talent.sourcing.external.ExternalCallException;
import com.talent.sourcing.external.ExternalPermanentException;
import com.talent.sourcing.external.HttpJsonClient;
import com.talent.sourcing.metrics.MetricsService;
import com.talent.sourcing.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Relevance classifier backed by a local Ollama model in JSON output mode.
 *
 * <pre>
 * RelevanceClassifier classifier = OllamaRelevanceClassifier.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 * </pre>
 */
public class OllamaRelevanceClassifier implements RelevanceClassifier {
    private static final Logger log = LoggerFactory.getLogger(OllamaRelevanceClassifier.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String model;
    private final ObjectMapper objectMapper;
    private final HttpJsonClient http;

    private OllamaRelevanceClassifier(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        Duration timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.http = new HttpJsonClient("relevance-classifier",
                builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder().connectTimeout(timeout).build(),
                timeout,
                objectMapper,
                builder.metrics != null ? builder.metrics : new NoOpMetricsService());
    }

    @Override
    public String classify(ClassificationRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("prompt", buildPrompt(request));
        body.put("stream", false);
        body.put("format", "json");

        log.debug("classifier.request model={} entities={}", model, request.entities().size());
        HttpJsonClient.JsonResponse response = http.postJson(URI.create(baseUrl + "/api/generate"), body, Map.of());
        JsonNode text = response.body().get("response");
        if (text == null || !text.isTextual()) {
            throw new ExternalPermanentException(http.getEndpoint(),
                    "Response has no 'response' field", response.status());
        }
        return text.asText();
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    @Override
    public boolean isAvailable() {
        try {
            http.get(URI.create(baseUrl + "/api/tags"), Map.of());
            return true;
        } catch (ExternalCallException e) {
            log.debug("classifier.unavailable provider={} error={}", getProviderName(), e.getMessage());
            return false;
        }
    }

    static String buildPrompt(ClassificationRequest request) {
        ScoringContext context = request.context();
        StringBuilder prompt = new StringBuilder();
        prompt.append("You rate companies as sources of candidates for a job opening.\n\n");
        prompt.append("Role: ").append(context.roleTitle()).append('\n');
        if (context.seniority() != null) {
            prompt.append("Seniority: ").append(context.seniority()).append('\n');
        }
        appendList(prompt, "Must have", context.mustHave());
        appendList(prompt, "Nice to have", context.niceToHave());
        appendList(prompt, "Domain", context.domainKeywords());

        prompt.append("\nCompanies:\n");
        List<Entity> entities = request.entities();
        for (int i = 0; i < entities.size(); i++) {
            Entity entity = entities.get(i);
            prompt.append(i).append(". ").append(entity.getName());
            EntityMetadata metadata = entity.getMetadata();
            if (metadata.industry() != null) {
                prompt.append(" (").append(metadata.industry()).append(')');
            }
            prompt.append('\n');
        }

        prompt.append("\nScore every company from ").append(request.minScore())
                .append(" (irrelevant) to ").append(request.maxScore())
                .append(" (ideal) with a one-sentence rationale.\n");
        prompt.append("Respond with JSON only: {\"scores\":[{\"index\":0,\"name\":\"...\",\"score\":7,\"rationale\":\"...\"}]}\n");
        return prompt.toString();
    }

    private static void appendList(StringBuilder prompt, String label, List<String> values) {
        if (!values.isEmpty()) {
            prompt.append(label).append(": ").append(String.join(", ", values)).append('\n');
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;
        private ObjectMapper objectMapper;
        private MetricsService metrics;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
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

        public OllamaRelevanceClassifier build() {
            return new OllamaRelevanceClassifier(this);
        }
    }
}
