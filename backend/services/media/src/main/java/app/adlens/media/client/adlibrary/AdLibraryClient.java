package app.adlens.media.client.adlibrary;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

@Component
public class AdLibraryClient {
    private static final Logger log = LoggerFactory.getLogger(AdLibraryClient.class);

    public static final int MAX_LIMIT = 1500;

    private final RestClient restClient;
    private final AdLibraryProps props;
    private final Clock clock;

    public AdLibraryClient(RestClient.Builder restClientBuilder, AdLibraryProps props, Clock clock) {
        this.restClient = restClientBuilder.baseUrl(props.baseUrl()).build();
        this.props = props;
        this.clock = clock;
    }

    public Map<String, String> findPlatformIds(String brandName) {
        JsonNode response = get(uri -> uri.path("/v1/facebook/adLibrary/search/companies")
                .queryParam("query", brandName)
                .build());
        Map<String, String> options = AdLibraryResponseParser.parseCompanies(response);
        log.info("Company search for '{}' returned {} result(s)", brandName, options.size());
        return options;
    }

    public List<AdRecord> getAds(String pageId, int limit, String country) {
        int capped = cap(limit);
        JsonNode response = get(uri -> {
            uri.path("/v1/facebook/adLibrary/company/ads")
                    .queryParam("pageId", pageId)
                    .queryParam("limit", capped)
                    .queryParam("trim", "true");
            if (country != null && !country.isBlank()) {
                uri.queryParam("country", country.trim().toUpperCase(Locale.ROOT));
            }
            return uri.build();
        });
        List<AdRecord> ads = AdLibraryResponseParser.parseAds(response.path("results"), true, clock.instant());
        return ads.size() > capped ? ads.subList(0, capped) : ads;
    }

    /**
     * Keyword search over active ads.
     */
    public List<AdRecord> searchAds(String query, int limit, String country) {
        int capped = cap(limit);
        JsonNode response = get(uri -> {
            uri.path("/v1/facebook/adLibrary/search/ads")
                    .queryParam("query", query)
                    .queryParam("limit", capped)
                    .queryParam("ad_type", "ALL")
                    .queryParam("media_type", "ALL")
                    .queryParam("active_status", "ACTIVE")
                    .queryParam("trim", "true");
            if (country != null && !country.isBlank()) {
                uri.queryParam("country", country.trim().toUpperCase(Locale.ROOT));
            }
            return uri.build();
        });
        List<AdRecord> ads = AdLibraryResponseParser.parseAds(response.path("searchResults"), false, clock.instant());
        return ads.size() > capped ? ads.subList(0, capped) : ads;
    }

    private JsonNode get(Function<UriBuilder, URI> uri) {
        if (props.apiKey() == null || props.apiKey().isBlank()) {
            throw new IllegalStateException("app.ad-library.api-key is required");
        }
        try {
            JsonNode response = restClient.get()
                    .uri(uri)
                    .header("x-api-key", props.apiKey())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, res) -> {
                        throw translate(res.getStatusCode());
                    })
                    .body(JsonNode.class);
            if (response == null) {
                throw new AdLibraryException(AdLibraryException.Reason.upstream_error, "Ad library response is empty");
            }
            return response;
        } catch (RestClientException ex) {
            throw new AdLibraryException(AdLibraryException.Reason.upstream_error,
                    "Ad library request failed: " + ex.getMessage(), ex);
        }
    }

    private static AdLibraryException translate(HttpStatusCode status) {
        if (status.value() == 402) {
            return new AdLibraryException(AdLibraryException.Reason.credits_exhausted,
                    "Ad library API credits exhausted");
        }
        if (status.value() == 429) {
            return new AdLibraryException(AdLibraryException.Reason.rate_limited,
                    "Ad library API rate limit exceeded");
        }
        return new AdLibraryException(AdLibraryException.Reason.upstream_error,
                "Ad library API returned " + status.value());
    }

    private static int cap(int limit) {
        if (limit <= 0) {
            return 50;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
