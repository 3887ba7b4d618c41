package app.adlens.media.client.adlibrary;

import app.adlens.media.domain.type.MediaKind;

import java.time.Instant;

/**
 * One ad creative. DCO ads yield one record per card.
 */
public record AdRecord(
        String adId,
        String pageName,
        String displayFormat,
        MediaKind mediaKind,
        String mediaUrl,
        String body,
        String title,
        Instant startDate,
        Instant endDate
) {
}
