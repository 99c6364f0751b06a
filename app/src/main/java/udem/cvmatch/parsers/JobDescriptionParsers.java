package udem.cvmatch.parsers;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import udem.cvmatch.dto.JobDescriptionDto;
import udem.cvmatch.scoring.ScoringConfig;

import java.io.IOException;

public class JobDescriptionParsers {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static JobDescriptionDto parseJobDescription(String json) {
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new RuntimeException("Empty JSON payload");
            }
            if (!node.isObject()) {
                throw new RuntimeException("Job description must be a JSON object, got " + node.getNodeType());
            }
            return MAPPER.treeToValue(node, JobDescriptionDto.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse job description JSON. Preview: " + preview(json, 200), e);
        }
    }

    /**
     * Reads scoring options; keys that are absent keep the value from {@code base}.
     */
    public static ScoringConfig parseScoringConfig(String json, ScoringConfig base) {
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                throw new RuntimeException("Scoring config must be a JSON object. Preview: " + preview(json, 200));
            }
            return new ScoringConfig(
                    asDouble(node, "mandatory_weight", base.mandatoryWeight()),
                    asDouble(node, "preferred_weight", base.preferredWeight()),
                    asDouble(node, "penalty_percent", base.penaltyPercent()),
                    asBoolean(node, "case_sensitive", base.caseSensitive()),
                    asBoolean(node, "normalize_text", base.normalizeText()),
                    node.has("parallelism") && !node.get("parallelism").isNull()
                            ? node.get("parallelism").asInt() : base.parallelism()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse scoring config JSON. Preview: " + preview(json, 200), e);
        }
    }

    private static double asDouble(JsonNode node, String field, double fallback) {
        JsonNode n = node.get(field);
        return (n == null || n.isNull()) ? fallback : n.asDouble();
    }

    private static boolean asBoolean(JsonNode node, String field, boolean fallback) {
        JsonNode n = node.get(field);
        return (n == null || n.isNull()) ? fallback : n.asBoolean();
    }

    static String preview(String s, int max) {
        if (s == null) return "null";
        s = s.replaceAll("\\s+", " ").trim();
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
