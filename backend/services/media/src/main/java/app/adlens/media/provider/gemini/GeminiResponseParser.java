package app.adlens.media.provider.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public final class GeminiResponseParser {
    private static final Logger log = LoggerFactory.getLogger(GeminiResponseParser.class);

    public static final String MISSING_SECTION = "Analysis not found in batch response for video ";

    private GeminiResponseParser() {
    }

    public static String extractText(JsonNode response) {
        if (response == null) {
            return "";
        }
        JsonNode candidates = response.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            return "";
        }
        JsonNode parts = candidates.get(0).path("content").path("parts");
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : parts) {
            String text = part.path("text").asText(null);
            if (text != null && !text.isBlank()) {
                if (!sb.isEmpty()) {
                    sb.append('\n');
                }
                sb.append(text);
            }
        }
        return sb.toString();
    }

    public static String extractModel(JsonNode response, String fallback) {
        String model = response == null ? null : response.path("modelVersion").asText(null);
        return model == null || model.isBlank() ? fallback : model;
    }

    public static GeminiFile extractFile(JsonNode node) {
        JsonNode file = node.has("file") ? node.path("file") : node;
        return new GeminiFile(
                file.path("name").asText(null),
                file.path("uri").asText(null),
                file.path("mimeType").asText(null),
                file.path("state").asText(null)
        );
    }

    /**
     * Parses model output that should be a JSON object, tolerating markdown code fences.
     * Anything else is wrapped as {@code raw_analysis}.
     */
    public static JsonNode parseJsonOutput(String text, ObjectMapper objectMapper) {
        String trimmed = stripFences(text);
        if (trimmed.startsWith("{")) {
            try {
                JsonNode parsed = objectMapper.readTree(trimmed);
                if (parsed != null && parsed.isObject()) {
                    return parsed;
                }
            } catch (JsonProcessingException e) {
                log.debug("Model output is not valid JSON, keeping raw text: {}", e.getOriginalMessage());
            }
        }
        ObjectNode raw = objectMapper.createObjectNode();
        raw.put("raw_analysis", text == null ? "" : text);
        return raw;
    }

    /**
     * Splits a combined answer on {@code VIDEO n:} markers. Sections that cannot be found get a placeholder.
     */
    public static List<String> splitVideoSections(String text, int count) {
        List<String> sections = new ArrayList<>(count);
        String body = text == null ? "" : text;
        for (int i = 1; i <= count; i++) {
            String marker = "VIDEO " + i + ":";
            int start = body.indexOf(marker);
            if (start < 0) {
                sections.add(MISSING_SECTION + i);
                continue;
            }
            start += marker.length();
            int end = i < count ? body.indexOf("VIDEO " + (i + 1) + ":", start) : -1;
            sections.add((end < 0 ? body.substring(start) : body.substring(start, end)).trim());
        }
        return sections;
    }

    private static String stripFences(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                trimmed = trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }
}
