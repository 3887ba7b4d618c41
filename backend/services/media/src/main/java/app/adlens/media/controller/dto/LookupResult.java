package app.adlens.media.controller.dto;

import app.adlens.media.domain.model.CachedMedia;

public record LookupResult(
        String url,
        boolean cached,
        CachedMedia entry
) {
}
