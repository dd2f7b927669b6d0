package br.edu.ifba.asrgot.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON object out of model output.
 *
 * <p>Models often wrap JSON in Markdown fences or surround it with prose. The parser
 * tries the fenced block first, then the outermost brace pair. A failure is not an
 * error: callers fall back to heuristic extraction.</p>
 */
public final class JsonResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(JsonResponseParser.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private JsonResponseParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Parses the first JSON object found in the text.
     *
     * @return the object node, or empty when no parseable object exists
     */
    @NotNull
    public static Optional<JsonNode> parseObject(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Matcher fenced = FENCED_BLOCK.matcher(text);
        if (fenced.find()) {
            Optional<JsonNode> node = tryParse(fenced.group(1));
            if (node.isPresent()) {
                return node;
            }
        }

        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            logger.debug("No JSON object found in response of length {}", text.length());
            return Optional.empty();
        }
        return tryParse(text.substring(start, end + 1));
    }

    /**
     * Text value of a field, or {@code null} when missing or blank.
     */
    @Nullable
    public static String text(@NotNull JsonNode node, @NotNull String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.isTextual() ? value.asText() : value.toString();
        return text.isBlank() ? null : text.trim();
    }

    /**
     * String items of an array field. A plain string value is returned as a single item.
     */
    @NotNull
    public static List<String> textList(@NotNull JsonNode node, @NotNull String field) {
        JsonNode value = node.get(field);
        List<String> items = new ArrayList<>();
        if (value == null || value.isNull()) {
            return items;
        }
        if (value.isArray()) {
            for (JsonNode item : value) {
                String text = item.isTextual() ? item.asText() : item.toString();
                if (!text.isBlank()) {
                    items.add(text.trim());
                }
            }
        } else if (!value.asText().isBlank()) {
            items.add(value.asText().trim());
        }
        return items;
    }

    private static Optional<JsonNode> tryParse(String candidate) {
        try {
            JsonNode node = OBJECT_MAPPER.readTree(candidate);
            if (node != null && node.isObject()) {
                return Optional.of(node);
            }
        } catch (JsonProcessingException e) {
            logger.debug("Response is not valid JSON: {}", e.getOriginalMessage());
        }
        return Optional.empty();
    }
}
