package app.adlens.media.domain.model;

import app.adlens.media.domain.type.MediaKind;

public record EvictedBlob(String key, String storagePath, MediaKind kind, long sizeBytes) {
}
