package app.adlens.media.service;

import app.adlens.media.config.MediaCacheProps;
import app.adlens.media.domain.model.CachedMedia;
import app.adlens.media.domain.model.EvictedBlob;
import app.adlens.media.domain.model.EvictionReport;
import app.adlens.media.domain.model.MediaCachePut;
import app.adlens.media.domain.model.MediaCacheRecord;
import app.adlens.media.domain.model.MediaCacheStats;
import app.adlens.media.domain.model.MediaSearchFilter;
import app.adlens.media.domain.type.MediaKind;
import app.adlens.media.service.exception.CacheEntryNotFoundException;
import app.adlens.media.service.exception.InvalidMediaInputException;
import app.adlens.media.service.policy.MediaContentPolicy;
import app.adlens.media.storage.BlobStore;
import app.adlens.media.support.MediaCacheKeys;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single entry point for cached media. Keeps the blob directory and the metadata table in step.
 */
@Service
public class MediaCacheService {
    private static final Logger log = LoggerFactory.getLogger(MediaCacheService.class);

    private final MediaMetadataStore store;
    private final BlobStore blobStore;
    private final MediaContentPolicy policy;
    private final MediaCacheProps props;
    private final Clock clock;
    private final ReentrantLock replaceLock = new ReentrantLock();

    public MediaCacheService(MediaMetadataStore store,
                             BlobStore blobStore,
                             MediaContentPolicy policy,
                             MediaCacheProps props,
                             Clock clock) {
        this.store = store;
        this.blobStore = blobStore;
        this.policy = policy;
        this.props = props;
        this.clock = clock;
    }

    public Optional<CachedMedia> getCached(String url, MediaKind kind) {
        String key = MediaCacheKeys.identify(url);
        Optional<CachedMedia> found = store.find(key, kind).filter(this::blobPresent);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Instant accessedAt = store.touch(List.of(key));
        log.debug("Cache hit for {}", url);
        return Optional.of(found.get().withLastAccessedAt(accessedAt));
    }

    /**
     * Looks up several URLs with one metadata query. The result holds every distinct input URL
     * in input order.
     */
    public Map<String, Optional<CachedMedia>> getCachedBatch(List<String> urls, MediaKind kind) {
        Map<String, Optional<CachedMedia>> result = new LinkedHashMap<>();
        if (urls == null || urls.isEmpty()) {
            return result;
        }
        Map<String, String> keyByUrl = new LinkedHashMap<>();
        for (String url : urls) {
            keyByUrl.putIfAbsent(url, MediaCacheKeys.identify(url));
        }
        Map<String, Optional<CachedMedia>> byKey = store.findAll(keyByUrl.values(), kind);

        Map<String, CachedMedia> hits = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : keyByUrl.entrySet()) {
            Optional<CachedMedia> cached = byKey.getOrDefault(entry.getValue(), Optional.empty())
                    .filter(this::blobPresent);
            cached.ifPresent(media -> hits.put(entry.getKey(), media));
        }
        Instant accessedAt = hits.isEmpty() ? null
                : store.touch(hits.values().stream().map(CachedMedia::key).toList());
        for (String url : keyByUrl.keySet()) {
            CachedMedia hit = hits.get(url);
            result.put(url, hit == null ? Optional.empty() : Optional.of(hit.withLastAccessedAt(accessedAt)));
        }
        log.debug("Batch lookup: {} urls, {} hits", keyByUrl.size(), hits.size());
        return result;
    }

    public Path put(MediaCachePut put) {
        return putBatch(List.of(put)).get(0);
    }

    /**
     * Writes all blobs first; metadata is only touched once every blob is on disk. Puts that share
     * a URL collapse to the last one, and every duplicate gets that entry's path back.
     */
    public List<Path> putBatch(List<MediaCachePut> puts) {
        if (puts == null || puts.isEmpty()) {
            return List.of();
        }
        puts.forEach(this::validate);
        List<String> keys = puts.stream().map(put -> MediaCacheKeys.identify(put.url())).toList();
        Map<String, MediaCachePut> latest = new LinkedHashMap<>();
        for (int i = 0; i < puts.size(); i++) {
            latest.put(keys.get(i), puts.get(i));
        }

        replaceLock.lock();
        try {
            return writeBlobsAndMetadata(keys, latest);
        } finally {
            replaceLock.unlock();
        }
    }

    /**
     * Runs under {@code replaceLock}: a superseded blob is only deleted once the row no longer
     * references it, and no other put can re-point the row in between.
     */
    private List<Path> writeBlobsAndMetadata(List<String> keys, Map<String, MediaCachePut> latest) {
        Map<String, Path> pathByKey = new LinkedHashMap<>();
        List<MediaCacheRecord> records = new ArrayList<>(latest.size());
        for (Map.Entry<String, MediaCachePut> entry : latest.entrySet()) {
            MediaCachePut put = entry.getValue();
            String contentType = policy.normalizeContentType(put.contentType());
            Path path = blobStore.write(entry.getKey(), put.kind(), contentType, put.bytes());
            pathByKey.put(entry.getKey(), path);
            records.add(new MediaCacheRecord(
                    entry.getKey(),
                    put.url(),
                    path.toString(),
                    put.kind(),
                    contentType,
                    put.bytes().length,
                    put.brandName(),
                    put.adId(),
                    put.analysis(),
                    put.durationSeconds(),
                    put.hasAudio()
            ));
        }
        for (String previous : store.putAll(records)) {
            blobStore.delete(Path.of(previous));
        }
        log.info("Cached {} media file(s)", records.size());
        return keys.stream().map(pathByKey::get).toList();
    }

    public void attachAnalysis(String url, JsonNode analysis) {
        if (analysis == null) {
            throw new InvalidMediaInputException("analysis is required");
        }
        String key = MediaCacheKeys.identify(url);
        if (!store.updateAnalysis(key, analysis)) {
            throw new CacheEntryNotFoundException(url);
        }
        log.info("Stored analysis for {}", url);
    }

    /**
     * Bytes of a cached entry. A vanished file purges the row and yields empty.
     */
    public Optional<byte[]> readBlob(CachedMedia media) {
        Optional<byte[]> bytes = blobStore.read(Path.of(media.storagePath()));
        if (bytes.isEmpty()) {
            purge(media);
        }
        return bytes;
    }

    public List<CachedMedia> search(MediaSearchFilter filter) {
        return store.search(filter);
    }

    public MediaCacheStats stats() {
        return store.stats();
    }

    public EvictionReport evictOlderThan(int maxAgeDays) {
        if (maxAgeDays < 0) {
            throw new InvalidMediaInputException("maxAgeDays must not be negative");
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(maxAgeDays));
        replaceLock.lock();
        try {
            return evict(cutoff);
        } finally {
            replaceLock.unlock();
        }
    }

    private EvictionReport evict(Instant cutoff) {
        List<EvictedBlob> evicted = store.deleteOlderThan(cutoff);

        long bytesFreed = 0;
        Map<MediaKind, Integer> byKind = new EnumMap<>(MediaKind.class);
        List<Path> leftovers = new ArrayList<>();
        for (EvictedBlob blob : evicted) {
            Path path = Path.of(blob.storagePath());
            if (!blobStore.delete(path) && Files.exists(path)) {
                leftovers.add(path);
            }
            bytesFreed += blob.sizeBytes();
            byKind.merge(blob.kind(), 1, Integer::sum);
        }
        log.info("Evicted {} cached media file(s) older than {} ({} bytes)", evicted.size(), cutoff, bytesFreed);
        if (!leftovers.isEmpty()) {
            log.warn("Eviction counted {} file(s) as removed that are still on disk: {}", leftovers.size(), leftovers);
        }
        return new EvictionReport(evicted.size(), bytesFreed, byKind, cutoff);
    }

    public EvictionReport evictExpired() {
        return evictOlderThan(props.maxAgeDays());
    }

    private boolean blobPresent(CachedMedia media) {
        if (blobStore.exists(Path.of(media.storagePath()))) {
            return true;
        }
        purge(media);
        return false;
    }

    private void purge(CachedMedia media) {
        if (store.deleteIfPathMatches(media.key(), media.storagePath())) {
            log.warn("Blob {} missing for cache key {}, entry purged", media.storagePath(), media.key());
        }
    }

    private void validate(MediaCachePut put) {
        if (put == null) {
            throw new InvalidMediaInputException("put is required");
        }
        if (put.url() == null || put.url().isBlank()) {
            throw new InvalidMediaInputException("url is required");
        }
        if (put.kind() == null) {
            throw new InvalidMediaInputException("kind is required");
        }
        if (put.bytes() == null) {
            throw new InvalidMediaInputException("bytes are required");
        }
    }
}
