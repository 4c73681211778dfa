package dev.opportunityfeed.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opportunityfeed.model.ClassificationResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a verdict out of free-form model output. Models wrap the JSON in prose or code
 * fences, so the key is located by pattern first and full JSON parsing is the fallback.
 * Output with no recognizable verdict is a low-confidence reject.
 */
@Slf4j
public final class ClassificationResponseParser {

    static final double DEFAULT_CONFIDENCE = 0.5;
    static final double UNPARSEABLE_CONFIDENCE = 0.3;

    private static final Pattern VERDICT = Pattern.compile("\"is_opportunity\"\\s*:\\s*(true|false)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONFIDENCE = Pattern.compile("\"confidence\"\\s*:\\s*([\\d.]+)");
    private static final Pattern REASONING = Pattern.compile("\"reasoning\"\\s*:\\s*\"([^\"]*)\"");
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[^{}]*\"is_opportunity\"[^{}]*}", Pattern.DOTALL);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ClassificationResponseParser() {
    }

    public static ClassificationResult parse(String responseText) {
        String text = responseText == null ? "" : responseText;

        Matcher verdict = VERDICT.matcher(text);
        if (verdict.find()) {
            boolean opportunity = Boolean.parseBoolean(verdict.group(1).toLowerCase());
            double confidence = confidence(text);
            Matcher reasoning = REASONING.matcher(text);
            String reason = reasoning.find() ? reasoning.group(1) : "Parsed from response";
            return result(opportunity, confidence, reason);
        }

        Matcher object = JSON_OBJECT.matcher(text);
        if (object.find()) {
            try {
                JsonNode node = MAPPER.readTree(object.group());
                boolean opportunity = node.path("is_opportunity").asBoolean(false);
                double confidence = node.path("confidence").asDouble(DEFAULT_CONFIDENCE);
                String reason = node.path("reasoning").asText("No reasoning provided");
                return result(opportunity, confidence, reason);
            } catch (JsonProcessingException e) {
                log.debug("Classifier reply contained malformed JSON: {}", e.getOriginalMessage());
            }
        }

        return ClassificationResult.reject(UNPARSEABLE_CONFIDENCE,
                "Unparseable classifier reply, rejecting: " + StringUtils.left(text, 100));
    }

    private static double confidence(String text) {
        Matcher matcher = CONFIDENCE.matcher(text);
        if (!matcher.find()) {
            return DEFAULT_CONFIDENCE;
        }
        try {
            return Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            return DEFAULT_CONFIDENCE;
        }
    }

    private static ClassificationResult result(boolean opportunity, double confidence, String reasoning) {
        return opportunity
                ? ClassificationResult.accept(confidence, reasoning)
                : ClassificationResult.reject(confidence, reasoning);
    }
}
