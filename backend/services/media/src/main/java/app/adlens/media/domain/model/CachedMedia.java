package app.adlens.media.domain.model;

import app.adlens.media.domain.type.MediaKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

public record CachedMedia(
        String key,
        String originalUrl,
        String storagePath,
        MediaKind kind,
        String contentType,
        long sizeBytes,
        Instant createdAt,
        Instant lastAccessedAt,
        String brandName,
        String adId,
        JsonNode analysis,
        Instant analysisCachedAt,
        List<String> dominantColors,
        Boolean hasPeople,
        List<String> textElements,
        Double durationSeconds,
        Boolean hasAudio
) {
    public boolean hasAnalysis() {
        return analysis != null;
    }

    public CachedMedia withLastAccessedAt(Instant accessedAt) {
        return new CachedMedia(key, originalUrl, storagePath, kind, contentType, sizeBytes, createdAt,
                accessedAt, brandName, adId, analysis, analysisCachedAt, dominantColors, hasPeople,
                textElements, durationSeconds, hasAudio);
    }
}
