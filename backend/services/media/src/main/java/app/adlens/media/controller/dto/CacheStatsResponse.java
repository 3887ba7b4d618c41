package app.adlens.media.controller.dto;

import app.adlens.media.domain.model.MediaCacheStats;
import app.adlens.media.domain.type.MediaKind;

import java.util.Map;

public record CacheStatsResponse(
        long totalFiles,
        long totalBytes,
        double totalMegabytes,
        long analyzedFiles,
        double analysisCoveragePercent,
        long uniqueBrands,
        Double averageVideoDurationSeconds,
        Map<MediaKind, MediaCacheStats.KindStats> byKind
) {
    public static CacheStatsResponse from(MediaCacheStats stats) {
        return new CacheStatsResponse(
                stats.totalFiles(),
                stats.totalBytes(),
                stats.totalMegabytes(),
                stats.analyzedFiles(),
                stats.analysisCoveragePercent(),
                stats.uniqueBrands(),
                stats.averageVideoDurationSeconds(),
                stats.byKind()
        );
    }
}
