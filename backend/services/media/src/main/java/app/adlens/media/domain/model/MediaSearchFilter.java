package app.adlens.media.domain.model;

import app.adlens.media.domain.type.MediaKind;

public record MediaSearchFilter(
        String brandName,
        Boolean hasPeople,
        String colorContains,
        MediaKind kind,
        int limit
) {
    public static final int DEFAULT_LIMIT = 20;

    public MediaSearchFilter {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
    }
}
