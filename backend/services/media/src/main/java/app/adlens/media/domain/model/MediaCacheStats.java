package app.adlens.media.domain.model;

import app.adlens.media.domain.type.MediaKind;

import java.util.Map;

public record MediaCacheStats(
        long totalFiles,
        long totalBytes,
        long analyzedFiles,
        long uniqueBrands,
        Double averageVideoDurationSeconds,
        Map<MediaKind, KindStats> byKind
) {
    public record KindStats(long count, long bytes, long analyzed) {
    }

    public double totalMegabytes() {
        return Math.round(totalBytes / (1024.0 * 1024.0) * 100.0) / 100.0;
    }

    public double analysisCoveragePercent() {
        if (totalFiles == 0) {
            return 0.0;
        }
        return Math.round(analyzedFiles * 1000.0 / totalFiles) / 10.0;
    }
}
