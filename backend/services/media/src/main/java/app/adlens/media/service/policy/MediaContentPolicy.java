package app.adlens.media.service.policy;

import app.adlens.media.domain.type.MediaKind;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

@Component
public class MediaContentPolicy {
    private static final String DEFAULT_IMAGE_EXTENSION = ".jpg";
    private static final String DEFAULT_VIDEO_EXTENSION = ".mp4";

    private static final Map<String, String> IMAGE_EXTENSIONS = Map.of(
            "image/jpeg", ".jpg",
            "image/jpg", ".jpg",
            "image/png", ".png",
            "image/gif", ".gif",
            "image/webp", ".webp"
    );

    private static final Map<String, String> VIDEO_EXTENSIONS = Map.of(
            "video/mp4", ".mp4",
            "video/quicktime", ".mov",
            "video/webm", ".webm",
            "video/x-msvideo", ".avi",
            "video/3gpp", ".3gp"
    );

    public String normalizeContentType(String contentType) {
        if (contentType == null) {
            return null;
        }
        String normalized = contentType.trim().toLowerCase(Locale.ROOT);
        int idx = normalized.indexOf(';');
        if (idx >= 0) {
            normalized = normalized.substring(0, idx).trim();
        }
        return normalized;
    }

    /**
     * File extension (with the leading dot) for a blob of the given kind.
     * Unknown or missing content types fall back to the kind's default.
     */
    public String extensionFor(MediaKind kind, String contentType) {
        String normalized = normalizeContentType(contentType);
        if (kind == MediaKind.video) {
            return normalized == null ? DEFAULT_VIDEO_EXTENSION
                    : VIDEO_EXTENSIONS.getOrDefault(normalized, DEFAULT_VIDEO_EXTENSION);
        }
        return normalized == null ? DEFAULT_IMAGE_EXTENSION
                : IMAGE_EXTENSIONS.getOrDefault(normalized, DEFAULT_IMAGE_EXTENSION);
    }

    public boolean looksLikeImage(String contentType) {
        String normalized = normalizeContentType(contentType);
        return normalized != null && normalized.startsWith("image/");
    }

    public boolean looksLikeVideo(String contentType) {
        String normalized = normalizeContentType(contentType);
        return normalized != null && normalized.startsWith("video/");
    }

    public boolean matches(MediaKind kind, String contentType) {
        return kind == MediaKind.video ? looksLikeVideo(contentType) : looksLikeImage(contentType);
    }
}
