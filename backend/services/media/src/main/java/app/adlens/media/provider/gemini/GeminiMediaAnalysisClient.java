package app.adlens.media.provider.gemini;

import app.adlens.media.domain.model.MediaInput;
import app.adlens.media.domain.type.MediaKind;
import app.adlens.media.provider.MediaAnalysisClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Gemini-backed analysis. Small payloads go inline; larger ones through the File API,
 * which are removed again once the answer is in.
 */
@Component
public class GeminiMediaAnalysisClient implements MediaAnalysisClient {
    private static final Logger log = LoggerFactory.getLogger(GeminiMediaAnalysisClient.class);

    private final GeminiClient client;
    private final GeminiProps props;
    private final ObjectMapper objectMapper;

    public GeminiMediaAnalysisClient(GeminiClient client, GeminiProps props, ObjectMapper objectMapper) {
        this.client = client;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode analyze(MediaInput input) {
        String apiKey = requireApiKey();
        boolean image = input.kind() == MediaKind.image;
        List<GeminiFile> uploaded = new ArrayList<>();
        try {
            ArrayNode parts = objectMapper.createArrayNode();
            parts.add(mediaPart(apiKey, input, uploaded));
            parts.add(client.textPart(image ? AdAnalysisPrompts.IMAGE : AdAnalysisPrompts.VIDEO));

            JsonNode response = client.generateContent(apiKey, props.model(), parts,
                    image ? "application/json" : null);
            String text = requireText(response);
            String model = GeminiResponseParser.extractModel(response, props.model());
            log.info("Analyzed {} {} with {}", input.kind(), input.url(), model);
            return image ? imageAnalysis(text, model) : videoAnalysis(text, model);
        } finally {
            cleanup(apiKey, uploaded);
        }
    }

    /**
     * Several videos go out in one request and the answer is split per video.
     * Anything else is analyzed one by one.
     */
    @Override
    public List<JsonNode> analyzeBatch(List<MediaInput> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            return List.of();
        }
        boolean allVideos = inputs.stream().allMatch(input -> input.kind() == MediaKind.video);
        if (inputs.size() == 1 || !allVideos) {
            return inputs.stream().map(this::analyze).toList();
        }

        String apiKey = requireApiKey();
        List<GeminiFile> uploaded = new ArrayList<>();
        try {
            ArrayNode parts = objectMapper.createArrayNode();
            parts.add(client.textPart(AdAnalysisPrompts.videoBatch(inputs.size())));
            for (MediaInput input : inputs) {
                parts.add(mediaPart(apiKey, input, uploaded));
            }
            JsonNode response = client.generateContent(apiKey, props.model(), parts, null);
            String text = requireText(response);
            String model = GeminiResponseParser.extractModel(response, props.model());

            List<String> sections = GeminiResponseParser.splitVideoSections(text, inputs.size());
            List<JsonNode> result = new ArrayList<>(sections.size());
            for (int i = 0; i < sections.size(); i++) {
                if (sections.get(i).startsWith(GeminiResponseParser.MISSING_SECTION)) {
                    log.warn("Batch answer has no section for video {} ({})", i + 1, inputs.get(i).url());
                }
                result.add(videoAnalysis(sections.get(i), model));
            }
            log.info("Analyzed {} videos in one request with {}", inputs.size(), model);
            return result;
        } finally {
            cleanup(apiKey, uploaded);
        }
    }

    private ObjectNode mediaPart(String apiKey, MediaInput input, List<GeminiFile> uploaded) {
        String mimeType = input.contentType() == null || input.contentType().isBlank()
                ? (input.kind() == MediaKind.video ? "video/mp4" : "image/jpeg")
                : input.contentType();
        if (input.bytes().length <= props.inlineLimitOrDefault()) {
            return client.inlinePart(input.bytes(), mimeType);
        }
        GeminiFile file = client.uploadFile(apiKey, input.bytes(), mimeType);
        uploaded.add(file);
        GeminiFile active = awaitActive(apiKey, file);
        return client.filePart(active.mimeType() == null
                ? new GeminiFile(active.name(), active.uri(), mimeType, active.state())
                : active);
    }

    private GeminiFile awaitActive(String apiKey, GeminiFile file) {
        GeminiFile current = file;
        int attempts = props.pollAttemptsOrDefault();
        for (int attempt = 0; attempt < attempts; attempt++) {
            if (current.active()) {
                return current;
            }
            if (current.failed()) {
                throw new IllegalStateException("Gemini failed to process file " + current.name());
            }
            try {
                Thread.sleep(props.pollIntervalOrDefault().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for Gemini file " + current.name(), e);
            }
            current = client.getFile(apiKey, current.id());
        }
        if (current.active()) {
            return current;
        }
        throw new IllegalStateException("Gemini file " + current.name() + " not ready after " + attempts + " polls");
    }

    private void cleanup(String apiKey, List<GeminiFile> uploaded) {
        for (GeminiFile file : uploaded) {
            try {
                client.deleteFile(apiKey, file.id());
            } catch (RestClientException ex) {
                log.warn("Failed to delete Gemini file {}: {}", file.name(), ex.getMessage());
            }
        }
    }

    private JsonNode imageAnalysis(String text, String model) {
        JsonNode parsed = GeminiResponseParser.parseJsonOutput(text, objectMapper);
        ((ObjectNode) parsed).put("model_used", model);
        return parsed;
    }

    private JsonNode videoAnalysis(String text, String model) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("raw_analysis", text);
        node.put("model_used", model);
        return node;
    }

    private static String requireText(JsonNode response) {
        String text = GeminiResponseParser.extractText(response);
        if (text.isBlank()) {
            throw new IllegalStateException("Gemini returned an empty analysis");
        }
        return text;
    }

    private String requireApiKey() {
        if (props.apiKey() == null || props.apiKey().isBlank()) {
            throw new IllegalStateException("app.ai.gemini.api-key is required for media analysis");
        }
        return props.apiKey();
    }
}
