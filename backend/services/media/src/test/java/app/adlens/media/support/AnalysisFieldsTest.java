package app.adlens.media.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisFieldsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void extractsDominantColorsInOrder() throws Exception {
        JsonNode analysis = objectMapper.readTree("""
                {"colors": {"dominant_colors": ["Red", "white", 3, " navy "]}}
                """);

        assertThat(AnalysisFields.dominantColors(analysis)).containsExactly("Red", "white", "navy");
    }

    @Test
    void hasPeopleFollowsPeopleDescription() throws Exception {
        assertThat(AnalysisFields.hasPeople(objectMapper.readTree("{\"people_description\": \"A woman smiling\"}")))
                .isTrue();
        assertThat(AnalysisFields.hasPeople(objectMapper.readTree("{\"people_description\": \"  \"}")))
                .isFalse();
        assertThat(AnalysisFields.hasPeople(objectMapper.readTree("{\"colors\": {}}")))
                .isFalse();
        assertThat(AnalysisFields.hasPeople(null)).isNull();
    }

    @Test
    void flattensTextElements() throws Exception {
        JsonNode analysis = objectMapper.readTree("""
                {"text_elements": {
                    "headline": ["Summer Sale", "50% off"],
                    "call_to_action": "Shop now",
                    "fine_print": {"nested": "ignored"}
                }}
                """);

        assertThat(AnalysisFields.textElements(analysis))
                .containsExactly("Summer Sale", "50% off", "Shop now");
    }

    @Test
    void keepsSeparatorCharactersInsideValues() throws Exception {
        JsonNode analysis = objectMapper.readTree("""
                {"colors": {"dominant_colors": ["rgb(255, 0, 0)", "navy"]},
                 "text_elements": {"headline": ["Save 20% | Free shipping"]}}
                """);

        assertThat(AnalysisFields.dominantColors(analysis)).containsExactly("rgb(255, 0, 0)", "navy");
        assertThat(AnalysisFields.textElements(analysis)).containsExactly("Save 20% | Free shipping");
    }

    @Test
    void acceptsTopLevelTextArray() throws Exception {
        JsonNode analysis = objectMapper.readTree("{\"text_elements\": [\"Buy\", \"\", \"Today\"]}");

        assertThat(AnalysisFields.textElements(analysis)).containsExactly("Buy", "Today");
    }
}
