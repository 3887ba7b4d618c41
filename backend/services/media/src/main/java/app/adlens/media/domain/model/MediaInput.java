package app.adlens.media.domain.model;

import app.adlens.media.domain.type.MediaKind;

/**
 * Media handed to an analysis provider.
 */
public record MediaInput(String url, byte[] bytes, String contentType, MediaKind kind) {
}
