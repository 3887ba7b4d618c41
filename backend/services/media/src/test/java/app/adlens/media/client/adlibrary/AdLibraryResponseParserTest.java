package app.adlens.media.client.adlibrary;

import app.adlens.media.domain.type.MediaKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class AdLibraryResponseParserTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_750_000_000L);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parsesImageVideoAndDcoAds() throws Exception {
        JsonNode results = objectMapper.readTree("""
                [
                  {"ad_archive_id": "1", "page_name": "Nike", "start_date": 1700000000,
                   "snapshot": {"display_format": "IMAGE",
                                "body": {"text": "Run faster"}, "title": "Air",
                                "images": [{"resized_image_url": "https://img/1.jpg"}, {"resized_image_url": "https://img/2.jpg"}]}},
                  {"ad_archive_id": "2",
                   "snapshot": {"display_format": "VIDEO", "page_name": "Nike",
                                "videos": [{"video_sd_url": "https://vid/1.mp4", "video_hd_url": "https://vid/1-hd.mp4"}]}},
                  {"ad_archive_id": "3",
                   "snapshot": {"display_format": "DCO", "body": {"text": "Shared body"},
                                "cards": [
                                  {"resized_image_url": "https://img/c1.jpg", "title": "Card one"},
                                  {"original_image_url": "https://img/c2.jpg", "body": {"text": "Own body"}},
                                  {"title": "no media"}
                                ]}}
                ]
                """);

        List<AdRecord> ads = AdLibraryResponseParser.parseAds(results, true, NOW);

        assertThat(ads).extracting(AdRecord::mediaUrl)
                .containsExactly("https://img/1.jpg", "https://vid/1.mp4", "https://img/c1.jpg", "https://img/c2.jpg");
        assertThat(ads.get(0).body()).isEqualTo("Run faster");
        assertThat(ads.get(0).title()).isEqualTo("Air");
        assertThat(ads.get(0).startDate()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(ads.get(1).mediaKind()).isEqualTo(MediaKind.video);
        assertThat(ads.get(1).pageName()).isEqualTo("Nike");
        assertThat(ads.get(2).title()).isEqualTo("Card one");
        assertThat(ads.get(2).body()).isEqualTo("Shared body");
        assertThat(ads.get(3).body()).isEqualTo("Own body");
        assertThat(ads).extracting(AdRecord::adId).containsExactly("1", "2", "3", "3");
    }

    @Test
    void skipsEndedUnsupportedAndMediaLessAds() throws Exception {
        JsonNode results = objectMapper.readTree("""
                [
                  {"ad_archive_id": "ended", "end_date": 1600000000,
                   "snapshot": {"display_format": "IMAGE", "images": [{"resized_image_url": "https://img/e.jpg"}]}},
                  {"ad_archive_id": "carousel",
                   "snapshot": {"display_format": "CAROUSEL", "images": [{"resized_image_url": "https://img/c.jpg"}]}},
                  {"ad_archive_id": "empty", "snapshot": {"display_format": "VIDEO", "videos": []}},
                  {"snapshot": {"display_format": "IMAGE", "images": [{"resized_image_url": "https://img/noid.jpg"}]}},
                  {"ad_archive_id": "running", "end_date": 1900000000,
                   "snapshot": {"display_format": "IMAGE", "images": [{"resized_image_url": "https://img/r.jpg"}]}}
                ]
                """);

        assertThat(AdLibraryResponseParser.parseAds(results, true, NOW))
                .extracting(AdRecord::adId)
                .containsExactly("running");
        assertThat(AdLibraryResponseParser.parseAds(results, false, NOW))
                .extracting(AdRecord::adId)
                .containsExactly("ended", "running");
    }

    @Test
    void parsesCompanySearchInOrder() throws Exception {
        JsonNode response = objectMapper.readTree("""
                {"searchResults": [
                  {"name": "Nike", "page_id": "15087023444"},
                  {"name": "Nike Football", "page_id": "123"},
                  {"name": "No id"}
                ]}
                """);

        assertThat(AdLibraryResponseParser.parseCompanies(response))
                .containsExactly(
                        entry("Nike", "15087023444"),
                        entry("Nike Football", "123"));
    }
}
