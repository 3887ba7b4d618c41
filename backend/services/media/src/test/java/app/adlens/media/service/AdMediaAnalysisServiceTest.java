package app.adlens.media.service;

import app.adlens.media.client.fetch.FetchedMedia;
import app.adlens.media.client.fetch.MediaFetcher;
import app.adlens.media.domain.model.CachedMedia;
import app.adlens.media.domain.model.MediaAnalysisResult;
import app.adlens.media.domain.model.MediaCachePut;
import app.adlens.media.domain.model.MediaInput;
import app.adlens.media.domain.type.MediaKind;
import app.adlens.media.provider.MediaAnalysisClient;
import app.adlens.media.service.exception.InvalidMediaInputException;
import app.adlens.media.service.exception.MediaFetchException;
import app.adlens.media.service.policy.MediaContentPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AdMediaAnalysisServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MediaCacheService cache;
    private MediaFetcher fetcher;
    private MediaAnalysisClient analysisClient;
    private AdMediaAnalysisService service;

    @BeforeEach
    void setUp() {
        cache = mock(MediaCacheService.class);
        fetcher = mock(MediaFetcher.class);
        analysisClient = mock(MediaAnalysisClient.class);
        service = new AdMediaAnalysisService(cache, fetcher, analysisClient, new MediaContentPolicy());
    }

    private CachedMedia cached(String url, MediaKind kind, JsonNode analysis) {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        return new CachedMedia("key-" + url.hashCode(), url, "/cache/" + url.hashCode(), kind,
                kind == MediaKind.image ? "image/jpeg" : "video/mp4", 3, now, now, "Nike", "ad-1",
                analysis, analysis == null ? null : now, List.of(), null, List.of(), null, null);
    }

    private static Map<String, Optional<CachedMedia>> lookup(Object... pairs) {
        Map<String, Optional<CachedMedia>> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], Optional.ofNullable((CachedMedia) pairs[i + 1]));
        }
        return map;
    }

    @Test
    void cachedAnalysisIsServedWithoutNetwork() throws Exception {
        String url = "https://x/a.jpg";
        JsonNode analysis = objectMapper.readTree("{\"people_description\": \"x\"}");
        when(cache.getCachedBatch(List.of(url), MediaKind.image))
                .thenReturn(lookup(url, cached(url, MediaKind.image, analysis)));

        List<MediaAnalysisResult> results = service.analyzeImages(List.of(url), null, null);

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.success()).isTrue();
            assertThat(result.fromCache()).isTrue();
            assertThat(result.analysis()).isEqualTo(analysis);
            assertThat(result.brandName()).isEqualTo("Nike");
        });
        verifyNoInteractions(fetcher, analysisClient);
        verify(cache, never()).putBatch(anyList());
    }

    @Test
    void cachedBytesWithoutAnalysisAreReanalyzed() throws Exception {
        String url = "https://x/a.jpg";
        CachedMedia media = cached(url, MediaKind.image, null);
        JsonNode analysis = objectMapper.readTree("{\"colors\": {}}");
        when(cache.getCachedBatch(List.of(url), MediaKind.image)).thenReturn(lookup(url, media));
        when(cache.readBlob(media)).thenReturn(Optional.of(new byte[]{1, 2, 3}));
        when(analysisClient.analyze(any(MediaInput.class))).thenReturn(analysis);

        List<MediaAnalysisResult> results = service.analyzeImages(List.of(url), "Nike", null);

        assertThat(results.get(0).success()).isTrue();
        assertThat(results.get(0).fromCache()).isFalse();
        assertThat(results.get(0).storagePath()).isEqualTo(media.storagePath());
        verifyNoInteractions(fetcher);
        verify(cache).attachAnalysis(url, analysis);
    }

    @Test
    void missesAreFetchedCachedAndAnalyzed() throws Exception {
        String ok = "https://x/ok.jpg";
        String html = "https://x/page";
        String broken = "https://x/broken.jpg";
        when(cache.getCachedBatch(List.of(ok, html, broken), MediaKind.image))
                .thenReturn(lookup(ok, null, html, null, broken, null));
        when(fetcher.fetch(ok)).thenReturn(new FetchedMedia(new byte[]{1}, "image/png; q=1"));
        when(fetcher.fetch(html)).thenReturn(new FetchedMedia(new byte[]{1}, "text/html"));
        when(fetcher.fetch(broken)).thenThrow(new MediaFetchException("404 Not Found"));
        when(cache.putBatch(anyList())).thenReturn(List.of(Path.of("/cache/images/ok.png")));
        JsonNode analysis = objectMapper.readTree("{\"people_description\": \"\"}");
        when(analysisClient.analyze(any(MediaInput.class))).thenReturn(analysis);

        List<MediaAnalysisResult> results = service.analyzeImages(List.of(ok, html, broken, ok), "Nike", "ad-9");

        assertThat(results).extracting(MediaAnalysisResult::url).containsExactly(ok, html, broken);
        assertThat(results.get(0).success()).isTrue();
        assertThat(results.get(0).storagePath()).isEqualTo("/cache/images/ok.png");
        assertThat(results.get(1).success()).isFalse();
        assertThat(results.get(1).error()).contains("text/html");
        assertThat(results.get(2).success()).isFalse();
        assertThat(results.get(2).error()).contains("404");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<MediaCachePut>> puts = ArgumentCaptor.forClass(List.class);
        verify(cache).putBatch(puts.capture());
        assertThat(puts.getValue()).singleElement().satisfies(put -> {
            assertThat(put.url()).isEqualTo(ok);
            assertThat(put.contentType()).isEqualTo("image/png");
            assertThat(put.brandName()).isEqualTo("Nike");
            assertThat(put.adId()).isEqualTo("ad-9");
        });
        verify(cache).attachAnalysis(ok, analysis);
    }

    @Test
    void analysisFailureIsReportedPerUrl() {
        String url = "https://x/a.jpg";
        when(cache.getCachedBatch(List.of(url), MediaKind.image)).thenReturn(lookup(url, null));
        when(fetcher.fetch(url)).thenReturn(new FetchedMedia(new byte[]{1}, "image/jpeg"));
        when(cache.putBatch(anyList())).thenReturn(List.of(Path.of("/cache/images/a.jpg")));
        when(analysisClient.analyze(any(MediaInput.class))).thenThrow(new IllegalStateException("quota"));

        List<MediaAnalysisResult> results = service.analyzeImages(List.of(url), null, null);

        assertThat(results.get(0).success()).isFalse();
        assertThat(results.get(0).error()).isEqualTo("quota");
        assertThat(results.get(0).storagePath()).isEqualTo("/cache/images/a.jpg");
        verify(cache, never()).attachAnalysis(eq(url), any());
    }

    @Test
    void severalVideosGoThroughOneBatchCall() throws Exception {
        String v1 = "https://x/1.mp4";
        String v2 = "https://x/2.mp4";
        when(cache.getCachedBatch(List.of(v1, v2), MediaKind.video)).thenReturn(lookup(v1, null, v2, null));
        when(fetcher.fetch(any())).thenReturn(new FetchedMedia(new byte[]{1}, "video/mp4"));
        when(cache.putBatch(anyList())).thenReturn(List.of(Path.of("/v/1.mp4"), Path.of("/v/2.mp4")));
        JsonNode first = objectMapper.readTree("{\"raw_analysis\": \"one\"}");
        JsonNode second = objectMapper.readTree("{\"raw_analysis\": \"two\"}");
        when(analysisClient.analyzeBatch(anyList())).thenReturn(List.of(first, second));

        List<MediaAnalysisResult> results = service.analyzeVideos(List.of(v1, v2), List.of("Nike", "Puma"), null);

        assertThat(results).extracting(MediaAnalysisResult::analysis).containsExactly(first, second);
        assertThat(results).extracting(MediaAnalysisResult::brandName).containsExactly("Nike", "Puma");
        assertThat(results).extracting(MediaAnalysisResult::storagePath).containsExactly("/v/1.mp4", "/v/2.mp4");
        verify(cache).attachAnalysis(v1, first);
        verify(cache).attachAnalysis(v2, second);
        verify(analysisClient, never()).analyze(any());
    }

    @Test
    void singleVideoUsesDirectAnalysis() throws Exception {
        String url = "https://x/1.mp4";
        when(cache.getCachedBatch(List.of(url), MediaKind.video)).thenReturn(lookup(url, null));
        when(fetcher.fetch(url)).thenReturn(new FetchedMedia(new byte[]{1}, "video/mp4"));
        when(cache.putBatch(anyList())).thenReturn(List.of(Path.of("/v/1.mp4")));
        JsonNode analysis = objectMapper.readTree("{\"raw_analysis\": \"ok\"}");
        when(analysisClient.analyze(any(MediaInput.class))).thenReturn(analysis);

        MediaAnalysisResult result = service.analyzeVideo(url, "Nike", "ad-1");

        assertThat(result.success()).isTrue();
        assertThat(result.adId()).isEqualTo("ad-1");
        verify(analysisClient, never()).analyzeBatch(anyList());
    }

    @Test
    void urlsAreTrimmedAndCollapsedBeforeLookup() throws Exception {
        String url = "https://x/1.mp4";
        JsonNode analysis = objectMapper.readTree("{\"raw_analysis\": \"cached\"}");
        when(cache.getCachedBatch(List.of(url), MediaKind.video))
                .thenReturn(lookup(url, cached(url, MediaKind.video, analysis)));

        List<MediaAnalysisResult> results = service.analyzeVideos(List.of(" " + url, url + "\n"),
                List.of("Nike", "Puma"), null);

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.url()).isEqualTo(url);
            assertThat(result.fromCache()).isTrue();
        });
        verifyNoInteractions(fetcher, analysisClient);
    }

    @Test
    void emptyUrlListIsRejected() {
        assertThatThrownBy(() -> service.analyzeImages(List.of(), null, null))
                .isInstanceOf(InvalidMediaInputException.class);
    }
}
