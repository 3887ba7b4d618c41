package app.adlens.media.support;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Quick-filter columns extracted from an analysis payload at write time.
 */
public final class AnalysisFields {
    private AnalysisFields() {
    }

    public static List<String> dominantColors(JsonNode analysis) {
        if (analysis == null) {
            return List.of();
        }
        JsonNode colors = analysis.path("colors").path("dominant_colors");
        if (!colors.isArray()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (JsonNode color : colors) {
            if (color.isTextual() && !color.asText().isBlank()) {
                result.add(color.asText().trim());
            }
        }
        return result;
    }

    public static Boolean hasPeople(JsonNode analysis) {
        if (analysis == null) {
            return null;
        }
        JsonNode people = analysis.get("people_description");
        if (people == null || people.isNull()) {
            return false;
        }
        if (people.isTextual()) {
            return !people.asText().isBlank();
        }
        if (people.isContainerNode()) {
            return !people.isEmpty();
        }
        return false;
    }

    public static List<String> textElements(JsonNode analysis) {
        if (analysis == null) {
            return List.of();
        }
        JsonNode node = analysis.get("text_elements");
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                collectText(fields.next().getValue(), result);
            }
        } else {
            collectText(node, result);
        }
        return result;
    }

    private static void collectText(JsonNode value, List<String> out) {
        if (value.isTextual()) {
            if (!value.asText().isBlank()) {
                out.add(value.asText().trim());
            }
        } else if (value.isArray()) {
            for (JsonNode item : value) {
                if (item.isTextual() && !item.asText().isBlank()) {
                    out.add(item.asText().trim());
                }
            }
        }
    }
}
