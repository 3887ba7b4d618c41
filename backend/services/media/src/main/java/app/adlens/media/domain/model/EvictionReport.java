package app.adlens.media.domain.model;

import app.adlens.media.domain.type.MediaKind;

import java.time.Instant;
import java.util.Map;

public record EvictionReport(
        int filesRemoved,
        long bytesFreed,
        Map<MediaKind, Integer> removedByKind,
        Instant cutoff
) {
}
