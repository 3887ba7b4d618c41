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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Download, cache and analyze ad creatives. Cached analyses are served without network calls.
 */
@Service
public class AdMediaAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(AdMediaAnalysisService.class);

    private final MediaCacheService cache;
    private final MediaFetcher fetcher;
    private final MediaAnalysisClient analysisClient;
    private final MediaContentPolicy policy;

    public AdMediaAnalysisService(MediaCacheService cache,
                                  MediaFetcher fetcher,
                                  MediaAnalysisClient analysisClient,
                                  MediaContentPolicy policy) {
        this.cache = cache;
        this.fetcher = fetcher;
        this.analysisClient = analysisClient;
        this.policy = policy;
    }

    public List<MediaAnalysisResult> analyzeImages(List<String> urls, String brandName, String adId) {
        List<Target> targets = new ArrayList<>();
        for (String url : requireUrls(urls)) {
            targets.add(new Target(url, brandName, adId));
        }
        return run(targets, MediaKind.image);
    }

    public MediaAnalysisResult analyzeVideo(String url, String brandName, String adId) {
        return analyzeVideos(List.of(url), brandName == null ? null : List.of(brandName),
                adId == null ? null : List.of(adId)).get(0);
    }

    /**
     * @param brandNames optional, aligned with {@code urls}
     * @param adIds      optional, aligned with {@code urls}
     */
    public List<MediaAnalysisResult> analyzeVideos(List<String> urls, List<String> brandNames, List<String> adIds) {
        List<String> distinct = requireUrls(urls);
        List<Target> targets = new ArrayList<>();
        for (String url : distinct) {
            int idx = indexOfTrimmed(urls, url);
            targets.add(new Target(url, at(brandNames, idx), at(adIds, idx)));
        }
        return run(targets, MediaKind.video);
    }

    private List<MediaAnalysisResult> run(List<Target> targets, MediaKind kind) {
        Map<String, Optional<CachedMedia>> cached = cache.getCachedBatch(
                targets.stream().map(Target::url).toList(), kind);

        Map<String, MediaAnalysisResult> results = new LinkedHashMap<>();
        Map<String, Pending> pending = new LinkedHashMap<>();
        List<MediaCachePut> puts = new ArrayList<>();

        for (Target target : targets) {
            Optional<CachedMedia> hit = cached.getOrDefault(target.url(), Optional.empty());
            if (hit.isPresent() && hit.get().hasAnalysis()) {
                CachedMedia media = hit.get();
                results.put(target.url(), new MediaAnalysisResult(target.url(), true, true, media.analysis(),
                        media.storagePath(), brandOr(media.brandName(), target), adOr(media.adId(), target), null));
                continue;
            }
            if (hit.isPresent()) {
                CachedMedia media = hit.get();
                Optional<byte[]> bytes = cache.readBlob(media);
                if (bytes.isPresent()) {
                    pending.put(target.url(), new Pending(target,
                            new MediaInput(target.url(), bytes.get(), media.contentType(), kind), media.storagePath()));
                    continue;
                }
            }
            try {
                FetchedMedia fetched = fetcher.fetch(target.url());
                if (!policy.matches(kind, fetched.contentType())) {
                    results.put(target.url(), MediaAnalysisResult.failed(target.url(), target.brandName(), target.adId(),
                            "Expected " + kind + " content but got " + fetched.contentType()));
                    continue;
                }
                String contentType = policy.normalizeContentType(fetched.contentType());
                puts.add(MediaCachePut.of(target.url(), fetched.bytes(), contentType, kind,
                        target.brandName(), target.adId()));
                pending.put(target.url(), new Pending(target,
                        new MediaInput(target.url(), fetched.bytes(), contentType, kind), null));
            } catch (MediaFetchException ex) {
                log.warn("Download failed for {}: {}", target.url(), ex.getMessage());
                results.put(target.url(), MediaAnalysisResult.failed(target.url(), target.brandName(), target.adId(),
                        ex.getMessage()));
            }
        }

        if (!puts.isEmpty()) {
            List<Path> paths = cache.putBatch(puts);
            for (int i = 0; i < puts.size(); i++) {
                Pending p = pending.get(puts.get(i).url());
                pending.put(p.target().url(), p.withStoragePath(paths.get(i).toString()));
            }
        }

        if (!pending.isEmpty()) {
            analyzePending(new ArrayList<>(pending.values()), kind, results);
        }

        List<MediaAnalysisResult> ordered = new ArrayList<>(targets.size());
        for (Target target : targets) {
            ordered.add(results.get(target.url()));
        }
        return ordered;
    }

    private void analyzePending(List<Pending> pending, MediaKind kind, Map<String, MediaAnalysisResult> results) {
        if (kind == MediaKind.video && pending.size() > 1) {
            List<JsonNode> analyses;
            try {
                analyses = analysisClient.analyzeBatch(pending.stream().map(Pending::input).toList());
            } catch (RuntimeException ex) {
                log.warn("Batch video analysis failed: {}", ex.getMessage());
                for (Pending p : pending) {
                    results.put(p.target().url(), failed(p, ex));
                }
                return;
            }
            for (int i = 0; i < pending.size(); i++) {
                Pending p = pending.get(i);
                try {
                    results.put(p.target().url(), store(p, analyses.get(i)));
                } catch (RuntimeException ex) {
                    log.warn("Storing analysis failed for {}: {}", p.target().url(), ex.getMessage());
                    results.put(p.target().url(), failed(p, ex));
                }
            }
            return;
        }
        for (Pending p : pending) {
            try {
                results.put(p.target().url(), store(p, analysisClient.analyze(p.input())));
            } catch (RuntimeException ex) {
                log.warn("Analysis failed for {}: {}", p.target().url(), ex.getMessage());
                results.put(p.target().url(), failed(p, ex));
            }
        }
    }

    private MediaAnalysisResult store(Pending p, JsonNode analysis) {
        cache.attachAnalysis(p.target().url(), analysis);
        return new MediaAnalysisResult(p.target().url(), true, false, analysis, p.storagePath(),
                p.target().brandName(), p.target().adId(), null);
    }

    private static MediaAnalysisResult failed(Pending p, RuntimeException ex) {
        return new MediaAnalysisResult(p.target().url(), false, false, null, p.storagePath(),
                p.target().brandName(), p.target().adId(), ex.getMessage());
    }

    private static List<String> requireUrls(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw new InvalidMediaInputException("At least one media url is required");
        }
        List<String> distinct = new ArrayList<>();
        for (String url : urls) {
            if (url == null || url.isBlank()) {
                throw new InvalidMediaInputException("Media urls must not be blank");
            }
            String trimmed = url.trim();
            if (!distinct.contains(trimmed)) {
                distinct.add(trimmed);
            }
        }
        return distinct;
    }

    private static int indexOfTrimmed(List<String> urls, String trimmed) {
        for (int i = 0; i < urls.size(); i++) {
            if (urls.get(i).trim().equals(trimmed)) {
                return i;
            }
        }
        return -1;
    }

    private static String at(List<String> values, int idx) {
        return values == null || idx < 0 || idx >= values.size() ? null : values.get(idx);
    }

    private static String brandOr(String stored, Target target) {
        return stored != null ? stored : target.brandName();
    }

    private static String adOr(String stored, Target target) {
        return stored != null ? stored : target.adId();
    }

    private record Target(String url, String brandName, String adId) {
    }

    private record Pending(Target target, MediaInput input, String storagePath) {
        Pending withStoragePath(String path) {
            return new Pending(target, input, path);
        }
    }
}
