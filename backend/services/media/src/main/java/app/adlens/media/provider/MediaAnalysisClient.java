package app.adlens.media.provider;

import app.adlens.media.domain.model.MediaInput;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public interface MediaAnalysisClient {
    JsonNode analyze(MediaInput input);

    /**
     * One analysis per input, in input order.
     */
    List<JsonNode> analyzeBatch(List<MediaInput> inputs);
}
