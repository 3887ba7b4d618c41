package app.adlens.media.domain.model;

import app.adlens.media.domain.type.MediaKind;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Metadata row as written after the blob is on disk.
 */
public record MediaCacheRecord(
        String key,
        String originalUrl,
        String storagePath,
        MediaKind kind,
        String contentType,
        long sizeBytes,
        String brandName,
        String adId,
        JsonNode analysis,
        Double durationSeconds,
        Boolean hasAudio
) {
}
