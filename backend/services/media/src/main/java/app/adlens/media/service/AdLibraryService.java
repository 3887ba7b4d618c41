package app.adlens.media.service;

import app.adlens.media.client.adlibrary.AdLibraryClient;
import app.adlens.media.client.adlibrary.AdRecord;
import app.adlens.media.service.exception.InvalidMediaInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class AdLibraryService {
    private static final Logger log = LoggerFactory.getLogger(AdLibraryService.class);

    private final AdLibraryClient client;

    public AdLibraryService(AdLibraryClient client) {
        this.client = client;
    }

    public Map<String, String> platformIds(String brandName) {
        requireText(brandName, "brandName");
        return client.findPlatformIds(brandName.trim());
    }

    /**
     * Resolves the brand's page (exact name match ignoring case, else the first result) and lists its ads.
     */
    public List<AdRecord> adsForBrand(String brandName, int limit, String country) {
        requireText(brandName, "brandName");
        Map<String, String> options = client.findPlatformIds(brandName.trim());
        if (options.isEmpty()) {
            log.info("No ad library page found for brand '{}'", brandName);
            return List.of();
        }
        String pageId = options.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(brandName.trim()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseGet(() -> options.values().iterator().next());
        return client.getAds(pageId, limit, country);
    }

    public List<AdRecord> searchAds(String query, int limit, String country) {
        requireText(query, "query");
        return client.searchAds(query.trim(), limit, country);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidMediaInputException(name + " is required");
        }
    }
}
