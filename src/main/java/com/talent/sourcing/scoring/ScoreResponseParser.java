package com.talent.sourcing.scoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talent.sourcing.core.model.Entity;
import com.talent.sourcing.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict parser for classifier output. Produces exactly one {@link ParsedScore} per entity of
 * the batch, in batch order. Entries are matched by {@code index}, falling back to the
 * normalized {@code name}. Anything missing, non-numeric or out of range is a parse failure
 * for that entity only.
 */
public class ScoreResponseParser {
    private static final Logger log = LoggerFactory.getLogger(ScoreResponseParser.class);

    private static final Pattern CODE_FENCE = Pattern.compile("(?s)^\\s*```(?:json)?\\s*(.*?)\\s*```\\s*$");

    private final ObjectMapper objectMapper;
    private final NameNormalizer normalizer;
    private final int minScore;
    private final int maxScore;

    public ScoreResponseParser(ObjectMapper objectMapper, NameNormalizer normalizer, int minScore, int maxScore) {
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
        this.minScore = minScore;
        this.maxScore = maxScore;
    }

    public List<ParsedScore> parse(String raw, List<Entity> batch) {
        JsonNode scores = readScores(raw);
        if (scores == null) {
            return allFailed(batch.size(), "unparseable classifier response");
        }

        Map<String, Integer> indexByKey = new HashMap<>();
        for (int i = 0; i < batch.size(); i++) {
            indexByKey.putIfAbsent(batch.get(i).getNormalizedKey(), i);
        }

        ParsedScore[] byIndex = new ParsedScore[batch.size()];
        for (JsonNode item : scores) {
            Integer index = locate(item, indexByKey, batch.size());
            if (index == null || byIndex[index] != null) {
                continue;
            }
            byIndex[index] = interpret(index, item);
        }

        List<ParsedScore> result = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            result.add(byIndex[i] != null ? byIndex[i] : ParsedScore.failed(i, "no score returned"));
        }
        return result;
    }

    private JsonNode readScores(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String json = raw;
        Matcher fence = CODE_FENCE.matcher(raw);
        if (fence.matches()) {
            json = fence.group(1);
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode scores = root == null ? null : root.get("scores");
            return scores != null && scores.isArray() ? scores : null;
        } catch (JsonProcessingException e) {
            log.debug("scoring.parseFailed error={}", e.getOriginalMessage());
            return null;
        }
    }

    private Integer locate(JsonNode item, Map<String, Integer> indexByKey, int size) {
        JsonNode index = item.get("index");
        if (index != null && index.canConvertToInt()) {
            int value = index.asInt();
            return value >= 0 && value < size ? value : null;
        }
        JsonNode name = item.get("name");
        if (name != null && name.isTextual()) {
            return indexByKey.get(normalizer.normalizeKey(name.asText()));
        }
        return null;
    }

    private ParsedScore interpret(int index, JsonNode item) {
        JsonNode score = item.get("score");
        if (score == null || !score.isNumber()) {
            return ParsedScore.failed(index, "missing or non-numeric score");
        }
        double value = score.asDouble();
        if (Double.isNaN(value) || value < minScore || value > maxScore) {
            return ParsedScore.failed(index, "score " + value + " outside " + minScore + "-" + maxScore);
        }
        JsonNode rationale = item.get("rationale");
        return ParsedScore.ok(index, value, rationale != null && rationale.isTextual() ? rationale.asText() : null);
    }

    private static List<ParsedScore> allFailed(int size, String reason) {
        List<ParsedScore> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            result.add(ParsedScore.failed(i, reason));
        }
        return result;
    }
}
