package app.adlens.media.provider.gemini;

import app.adlens.media.domain.model.MediaInput;
import app.adlens.media.domain.type.MediaKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiMediaAnalysisClientTest {

    private static final String BASE = "https://gemini.example.test";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private RestClient.Builder builder;

    @BeforeEach
    void setUp() {
        builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
    }

    private GeminiMediaAnalysisClient client(long inlineLimit, String apiKey) {
        GeminiProps props = new GeminiProps(BASE, apiKey, "gemini-test", inlineLimit, Duration.ZERO, 3);
        return new GeminiMediaAnalysisClient(new GeminiClient(builder, props, objectMapper), props, objectMapper);
    }

    private static String answer(String text) {
        return """
                {"candidates": [{"content": {"parts": [{"text": %s}]}}], "modelVersion": "gemini-test-001"}
                """.formatted(new ObjectMapper().valueToTree(text).toString());
    }

    @Test
    void imageIsSentInlineAndParsedAsJson() {
        server.expect(requestTo(BASE + "/v1beta/models/gemini-test:generateContent"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-goog-api-key", "key"))
                .andExpect(jsonPath("$.contents[0].parts[0].inline_data.mime_type").value("image/png"))
                .andExpect(jsonPath("$.generationConfig.responseMimeType").value("application/json"))
                .andRespond(withSuccess(answer("{\"people_description\": \"A runner\"}"), MediaType.APPLICATION_JSON));

        JsonNode analysis = client(1024, "key").analyze(
                new MediaInput("https://x/a.png", new byte[]{1, 2}, "image/png", MediaKind.image));

        assertThat(analysis.path("people_description").asText()).isEqualTo("A runner");
        assertThat(analysis.path("model_used").asText()).isEqualTo("gemini-test-001");
        server.verify();
    }

    @Test
    void largeVideoGoesThroughFileApiAndIsDeleted() {
        server.expect(requestTo(BASE + "/upload/v1beta/files"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-Goog-Upload-Protocol", "raw"))
                .andRespond(withSuccess("""
                        {"file": {"name": "files/v1", "uri": "https://files/v1", "mimeType": "video/mp4", "state": "PROCESSING"}}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v1beta/files/v1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"name": "files/v1", "uri": "https://files/v1", "mimeType": "video/mp4", "state": "ACTIVE"}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v1beta/models/gemini-test:generateContent"))
                .andExpect(jsonPath("$.contents[0].parts[0].file_data.file_uri").value("https://files/v1"))
                .andRespond(withSuccess(answer("Hook: shoes in motion."), MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v1beta/files/v1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        JsonNode analysis = client(1, "key").analyze(
                new MediaInput("https://x/v.mp4", new byte[]{1, 2, 3}, "video/mp4", MediaKind.video));

        assertThat(analysis.path("raw_analysis").asText()).isEqualTo("Hook: shoes in motion.");
        server.verify();
    }

    @Test
    void videoBatchIsSplitPerVideo() {
        server.expect(requestTo(BASE + "/v1beta/models/gemini-test:generateContent"))
                .andExpect(jsonPath("$.contents[0].parts.length()").value(3))
                .andRespond(withSuccess(answer("VIDEO 1: fast cuts\nVIDEO 2: slow pan"), MediaType.APPLICATION_JSON));

        List<JsonNode> analyses = client(1024, "key").analyzeBatch(List.of(
                new MediaInput("https://x/1.mp4", new byte[]{1}, "video/mp4", MediaKind.video),
                new MediaInput("https://x/2.mp4", new byte[]{2}, "video/mp4", MediaKind.video)
        ));

        assertThat(analyses).extracting(node -> node.path("raw_analysis").asText())
                .containsExactly("fast cuts", "slow pan");
    }

    @Test
    void missingApiKeyFailsAtCallTime() {
        GeminiMediaAnalysisClient client = client(1024, " ");

        assertThatThrownBy(() -> client.analyze(
                new MediaInput("https://x/a.png", new byte[]{1}, "image/png", MediaKind.image)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("api-key");
    }
}
