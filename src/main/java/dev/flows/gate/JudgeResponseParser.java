package dev.flows.gate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a judge's free-form answer into an {@link EvaluationResult}.
 *
 * <p>Extraction order: a fenced {@code ```json} block, else the outermost {@code {...}}; if that
 * does not parse, a repaired copy (trailing commas, bare keys, single quotes); if nothing
 * parses, scores are picked out of the prose ({@code clarity: 0.8}, {@code clarity - 80%}).
 * Scores above 1 are read as percentages.
 */
public final class JudgeResponseParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final Pattern BARE_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([\\]}])");
    private static final Pattern BARE_KEY = Pattern.compile("([{,]\\s*)(\\w+)(\\s*:)");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*[-+]?(\\d+\\.?\\d*|\\.\\d+)");

    private JudgeResponseParser() {}

    public static EvaluationResult parse(String response, List<EvaluationCriterion> criteria) {
        String json = extractJson(response);
        if (json == null) {
            return parseHeuristic(response, criteria);
        }

        JsonNode parsed = readObject(json);
        if (parsed == null) {
            parsed = readObject(repair(json));
        }
        if (parsed == null) {
            return parseHeuristic(response, criteria);
        }
        return normalize(parsed, criteria);
    }

    static String extractJson(String response) {
        Matcher fenced = FENCED_JSON.matcher(response);
        if (fenced.find()) {
            return fenced.group(1);
        }
        Matcher bare = BARE_OBJECT.matcher(response);
        return bare.find() ? bare.group() : null;
    }

    static String repair(String json) {
        String repaired = TRAILING_COMMA.matcher(json).replaceAll("$1");
        repaired = BARE_KEY.matcher(repaired).replaceAll("$1\"$2\"$3");
        return repaired.replace('\'', '"');
    }

    /**
     * Bring a score into [0, 1]. Numbers above 1 are percentages; text is read up to the
     * first non-numeric character; anything else scores 0.
     */
    static double normalizeScore(JsonNode value) {
        if (value == null) {
            return 0;
        }
        if (value.isNumber()) {
            return normalizeScore(value.asDouble());
        }
        if (value.isTextual()) {
            return normalizeScore(value.asText());
        }
        return 0;
    }

    static double normalizeScore(String text) {
        Matcher m = LEADING_NUMBER.matcher(text);
        return m.find() ? normalizeScore(Double.parseDouble(m.group().trim())) : 0;
    }

    static double normalizeScore(double value) {
        if (value > 1) {
            return Math.min(1, value / 100);
        }
        return Math.max(0, Math.min(1, value));
    }

    private static JsonNode readObject(String json) {
        try {
            JsonNode node = MAPPER.readTree(json);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static EvaluationResult normalize(JsonNode parsed, List<EvaluationCriterion> criteria) {
        Map<String, CriterionResult> scores = new LinkedHashMap<>();
        for (EvaluationCriterion criterion : criteria) {
            scores.put(criterion.name(), criterionFrom(parsed, criterion.name()));
        }

        double overall = criteria.isEmpty()
            ? normalizeScore(parsed.get("overallScore"))
            : CriteriaLibrary.weightedScore(scores, criteria);

        String feedback = text(parsed.get("feedback"));
        if (feedback.isEmpty()) {
            feedback = text(parsed.get("summary"));
        }
        return new EvaluationResult(overall, scores, overall >= CriteriaLibrary.REQUIRED_FLOOR, feedback,
            strings(parsed.get("suggestions")), new EvaluationResult.Metadata(Instant.now(), null, null));
    }

    private static CriterionResult criterionFrom(JsonNode parsed, String name) {
        JsonNode nested = parsed.path("criteriaScores").get(name);
        if (nested != null && nested.isObject()) {
            return CriterionResult.scored(name, normalizeScore(nested.get("score")),
                firstText(nested, "reasoning", "reason"), strings(nested.get("issues")));
        }

        JsonNode flat = parsed.path("scores");
        if (flat.isObject() && flat.has(name)) {
            return CriterionResult.scored(name, normalizeScore(flat.get(name)), "", List.of());
        }

        JsonNode top = parsed.get(name);
        if (top != null) {
            if (top.isObject()) {
                JsonNode score = top.has("score") ? top.get("score") : top.get("value");
                return CriterionResult.scored(name, normalizeScore(score),
                    firstText(top, "reasoning", "reason", "feedback"), strings(top.get("issues")));
            }
            return CriterionResult.scored(name, normalizeScore(top), "", List.of());
        }

        return new CriterionResult(name, 0, "Criterion not evaluated",
            List.of("Criterion score not found in response"), false);
    }

    private static EvaluationResult parseHeuristic(String response, List<EvaluationCriterion> criteria) {
        Map<String, CriterionResult> scores = new LinkedHashMap<>();
        for (EvaluationCriterion criterion : criteria) {
            String name = criterion.name();
            String spaced = Pattern.compile("_").splitAsStream(name)
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s*"));
            List<Pattern> patterns = List.of(
                Pattern.compile(Pattern.quote(name) + "[:\\s-]+([\\d.]+)", Pattern.CASE_INSENSITIVE),
                Pattern.compile(Pattern.quote(name) + "[:\\s-]+(\\d+)%", Pattern.CASE_INSENSITIVE),
                Pattern.compile(spaced + "[:\\s-]+([\\d.]+)", Pattern.CASE_INSENSITIVE));

            double score = 0;
            boolean found = false;
            for (Pattern pattern : patterns) {
                Matcher m = pattern.matcher(response);
                if (m.find()) {
                    score = normalizeScore(m.group(1));
                    found = true;
                    break;
                }
            }

            Matcher reasoning = Pattern.compile(Pattern.quote(name) + "[^.]*\\.\\s*([^.]+\\.)",
                Pattern.CASE_INSENSITIVE).matcher(response);
            scores.put(name, CriterionResult.scored(name, score,
                reasoning.find() ? reasoning.group(1).trim() : "",
                found ? List.of() : List.of("Score extracted heuristically")));
        }

        double overall = CriteriaLibrary.weightedScore(scores, criteria);
        return new EvaluationResult(overall, scores, overall >= CriteriaLibrary.REQUIRED_FLOOR,
            "Evaluation extracted heuristically from response", List.of(),
            new EvaluationResult.Metadata(Instant.now(), null, null));
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node.get(field));
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> values.add(item.isTextual() ? item.asText() : item.toString()));
        }
        return values;
    }
}
