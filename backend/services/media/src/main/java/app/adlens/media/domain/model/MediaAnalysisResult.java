package app.adlens.media.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

public record MediaAnalysisResult(
        String url,
        boolean success,
        boolean fromCache,
        JsonNode analysis,
        String storagePath,
        String brandName,
        String adId,
        String error
) {
    public static MediaAnalysisResult failed(String url, String brandName, String adId, String error) {
        return new MediaAnalysisResult(url, false, false, null, null, brandName, adId, error);
    }
}
