package app.adlens.media.client.adlibrary;

import app.adlens.media.domain.type.MediaKind;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class AdLibraryResponseParser {
    private static final Logger log = LoggerFactory.getLogger(AdLibraryResponseParser.class);

    private static final Set<String> SUPPORTED_FORMATS = Set.of("IMAGE", "VIDEO", "DCO");

    private AdLibraryResponseParser() {
    }

    /**
     * @param filterInactive skip ads whose end date is before {@code now}
     */
    public static List<AdRecord> parseAds(JsonNode results, boolean filterInactive, Instant now) {
        List<AdRecord> ads = new ArrayList<>();
        if (results == null || !results.isArray()) {
            return ads;
        }
        for (JsonNode ad : results) {
            String adId = text(ad.path("ad_archive_id"));
            if (adId == null) {
                continue;
            }
            Instant startDate = epochSeconds(ad.path("start_date"));
            Instant endDate = epochSeconds(ad.path("end_date"));
            if (filterInactive && endDate != null && endDate.isBefore(now)) {
                log.debug("Skipping inactive ad {} ended at {}", adId, endDate);
                continue;
            }

            JsonNode snapshot = ad.path("snapshot");
            String format = text(snapshot.path("display_format"));
            if (format == null || !SUPPORTED_FORMATS.contains(format)) {
                continue;
            }
            String pageName = text(ad.path("page_name"));
            if (pageName == null) {
                pageName = text(snapshot.path("page_name"));
            }
            String body = textOrField(snapshot.path("body"));
            String title = textOrField(snapshot.path("title"));

            switch (format) {
                case "IMAGE" -> {
                    String url = text(snapshot.path("images").path(0).path("resized_image_url"));
                    if (url != null) {
                        ads.add(new AdRecord(adId, pageName, format, MediaKind.image, url, body, title, startDate, endDate));
                    }
                }
                case "VIDEO" -> {
                    String url = text(snapshot.path("videos").path(0).path("video_sd_url"));
                    if (url != null) {
                        ads.add(new AdRecord(adId, pageName, format, MediaKind.video, url, body, title, startDate, endDate));
                    }
                }
                default -> {
                    for (JsonNode card : snapshot.path("cards")) {
                        String url = firstText(card, "resized_image_url", "original_image_url", "video_preview_image_url");
                        if (url == null) {
                            continue;
                        }
                        String cardBody = textOrField(card.path("body"));
                        String cardTitle = textOrField(card.path("title"));
                        ads.add(new AdRecord(
                                adId,
                                pageName,
                                format,
                                MediaKind.image,
                                url,
                                cardBody != null ? cardBody : body,
                                cardTitle != null ? cardTitle : title,
                                startDate,
                                endDate
                        ));
                    }
                }
            }
        }
        return ads;
    }

    /**
     * Company search results as name to page id, in response order.
     */
    public static Map<String, String> parseCompanies(JsonNode response) {
        Map<String, String> options = new LinkedHashMap<>();
        if (response == null) {
            return options;
        }
        for (JsonNode result : response.path("searchResults")) {
            String name = text(result.path("name"));
            String pageId = text(result.path("page_id"));
            if (name != null && pageId != null) {
                options.put(name, pageId);
            }
        }
        return options;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node.path(field));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String textOrField(JsonNode node) {
        if (node.isObject()) {
            return text(node.path("text"));
        }
        return text(node);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static Instant epochSeconds(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        return Instant.ofEpochSecond(node.asLong());
    }
}
