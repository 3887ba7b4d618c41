package app.adlens.media.provider.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Base64;

@Component
public class GeminiClient {
    private static final String API_KEY_HEADER = "x-goog-api-key";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public GeminiClient(RestClient.Builder restClientBuilder,
                        GeminiProps props,
                        ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.baseUrl(props.baseUrl()).build();
        this.objectMapper = objectMapper;
    }

    public JsonNode generateContent(String apiKey, String model, ArrayNode parts, String responseMimeType) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode contents = payload.putArray("contents");
        ObjectNode user = contents.addObject();
        user.put("role", "user");
        user.set("parts", parts);

        if (responseMimeType != null && !responseMimeType.isBlank()) {
            payload.putObject("generationConfig").put("responseMimeType", responseMimeType);
        }

        JsonNode response = restClient.post()
                .uri("/v1beta/models/{model}:generateContent", model)
                .header(API_KEY_HEADER, apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new IllegalStateException("Gemini response is empty");
        }
        return response;
    }

    public GeminiFile uploadFile(String apiKey, byte[] bytes, String mimeType) {
        JsonNode response = restClient.post()
                .uri("/upload/v1beta/files")
                .header(API_KEY_HEADER, apiKey)
                .header("X-Goog-Upload-Protocol", "raw")
                .contentType(MediaType.parseMediaType(mimeType))
                .body(bytes)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new IllegalStateException("Gemini file upload response is empty");
        }
        GeminiFile file = GeminiResponseParser.extractFile(response);
        if (file.name() == null) {
            throw new IllegalStateException("Gemini file upload returned no file name");
        }
        return file;
    }

    public GeminiFile getFile(String apiKey, String fileId) {
        JsonNode response = restClient.get()
                .uri("/v1beta/files/{id}", fileId)
                .header(API_KEY_HEADER, apiKey)
                .retrieve()
                .body(JsonNode.class);
        if (response == null) {
            throw new IllegalStateException("Gemini file status response is empty");
        }
        return GeminiResponseParser.extractFile(response);
    }

    public void deleteFile(String apiKey, String fileId) {
        restClient.delete()
                .uri("/v1beta/files/{id}", fileId)
                .header(API_KEY_HEADER, apiKey)
                .retrieve()
                .toBodilessEntity();
    }

    public ObjectNode textPart(String text) {
        return objectMapper.createObjectNode().put("text", text);
    }

    public ObjectNode inlinePart(byte[] bytes, String mimeType) {
        ObjectNode part = objectMapper.createObjectNode();
        ObjectNode inline = part.putObject("inline_data");
        inline.put("mime_type", mimeType);
        inline.put("data", Base64.getEncoder().encodeToString(bytes));
        return part;
    }

    public ObjectNode filePart(GeminiFile file) {
        ObjectNode part = objectMapper.createObjectNode();
        ObjectNode data = part.putObject("file_data");
        data.put("mime_type", file.mimeType());
        data.put("file_uri", file.uri());
        return part;
    }
}
