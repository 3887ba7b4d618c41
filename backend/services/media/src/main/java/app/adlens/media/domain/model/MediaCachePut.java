package app.adlens.media.domain.model;

import app.adlens.media.domain.type.MediaKind;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Bytes and metadata for one cache write. {@code analysis} may be null.
 */
public record MediaCachePut(
        String url,
        byte[] bytes,
        String contentType,
        MediaKind kind,
        String brandName,
        String adId,
        JsonNode analysis,
        Double durationSeconds,
        Boolean hasAudio
) {
    public static MediaCachePut of(String url, byte[] bytes, String contentType, MediaKind kind,
                                   String brandName, String adId) {
        return new MediaCachePut(url, bytes, contentType, kind, brandName, adId, null, null, null);
    }
}
