package app.adlens.media.service;

import app.adlens.media.domain.entity.MediaCacheEntryEntity;
import app.adlens.media.domain.model.CachedMedia;
import app.adlens.media.domain.model.EvictedBlob;
import app.adlens.media.domain.model.MediaCacheRecord;
import app.adlens.media.domain.model.MediaCacheStats;
import app.adlens.media.domain.model.MediaSearchFilter;
import app.adlens.media.domain.type.MediaKind;
import app.adlens.media.repository.MediaCacheEntryRepository;
import app.adlens.media.service.exception.MediaStorageException;
import app.adlens.media.support.AnalysisFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Durable index of cached media. Writes are serialized through one lock per process;
 * reads go straight to the database.
 */
@Service
public class MediaMetadataStore {
    private static final Logger log = LoggerFactory.getLogger(MediaMetadataStore.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final MediaCacheEntryRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public MediaMetadataStore(MediaCacheEntryRepository repository,
                              PlatformTransactionManager transactionManager,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<CachedMedia> find(String key, MediaKind kind) {
        return repository.findById(key)
                .filter(entity -> kind == null || entity.getMediaKind() == kind)
                .map(this::toModel);
    }

    /**
     * Every requested key is present in the result; misses map to an empty optional.
     */
    @Transactional(readOnly = true)
    public Map<String, Optional<CachedMedia>> findAll(Collection<String> keys, MediaKind kind) {
        Map<String, Optional<CachedMedia>> result = new LinkedHashMap<>();
        if (keys == null || keys.isEmpty()) {
            return result;
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>(keys);
        Map<String, MediaCacheEntryEntity> found = repository.findByCacheKeyIn(distinct).stream()
                .filter(entity -> kind == null || entity.getMediaKind() == kind)
                .collect(Collectors.toMap(MediaCacheEntryEntity::getCacheKey, Function.identity()));
        for (String key : distinct) {
            result.put(key, Optional.ofNullable(found.get(key)).map(this::toModel));
        }
        return result;
    }

    /**
     * Inserts or fully replaces the row for {@code record.key()}.
     *
     * @return storage path of the replaced row when it differs from the new one
     */
    public Optional<String> put(MediaCacheRecord record) {
        List<String> stale = putAll(List.of(record));
        return stale.isEmpty() ? Optional.empty() : Optional.of(stale.get(0));
    }

    /**
     * Bulk insert-or-replace in one transaction. Returns superseded storage paths.
     */
    public List<String> putAll(List<MediaCacheRecord> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        return locked(() -> {
            Instant now = clock.instant();
            Map<String, MediaCacheRecord> byKey = new LinkedHashMap<>();
            for (MediaCacheRecord record : records) {
                byKey.put(record.key(), record);
            }
            Map<String, String> previousPaths = new LinkedHashMap<>();
            for (MediaCacheEntryEntity existing : repository.findAllById(byKey.keySet())) {
                previousPaths.put(existing.getCacheKey(), existing.getStoragePath());
            }
            List<MediaCacheEntryEntity> entities = byKey.values().stream()
                    .map(record -> toEntity(record, now))
                    .toList();
            repository.saveAll(entities);

            List<String> stale = new ArrayList<>();
            for (MediaCacheRecord record : byKey.values()) {
                String previous = previousPaths.get(record.key());
                if (previous != null && !previous.equals(record.storagePath())) {
                    stale.add(previous);
                }
            }
            return stale;
        });
    }

    /**
     * Stores the analysis and its derived columns. Returns {@code false} when the key is unknown.
     */
    public boolean updateAnalysis(String key, JsonNode analysis) {
        return locked(() -> repository.findById(key)
                .map(entity -> {
                    applyAnalysis(entity, analysis, clock.instant());
                    repository.save(entity);
                    return true;
                })
                .orElse(false));
    }

    @Transactional(readOnly = true)
    public List<CachedMedia> search(MediaSearchFilter filter) {
        String color = filter.colorContains() == null || filter.colorContains().isBlank()
                ? null
                : filter.colorContains().trim().toLowerCase(Locale.ROOT);
        String brand = filter.brandName() == null || filter.brandName().isBlank() ? null : filter.brandName();
        return repository.search(brand, filter.hasPeople(), color, filter.kind(), PageRequest.of(0, filter.limit()))
                .stream()
                .map(this::toModel)
                .toList();
    }

    /**
     * Removes rows created before {@code cutoff} and returns what they pointed at.
     */
    public List<EvictedBlob> deleteOlderThan(Instant cutoff) {
        return locked(() -> {
            List<MediaCacheEntryEntity> expired = repository.findByCreatedAtBefore(cutoff);
            if (expired.isEmpty()) {
                return List.of();
            }
            List<EvictedBlob> evicted = expired.stream()
                    .map(e -> new EvictedBlob(e.getCacheKey(), e.getStoragePath(), e.getMediaKind(), e.getSizeBytes()))
                    .toList();
            repository.deleteAllInBatch(expired);
            return evicted;
        });
    }

    public Instant touch(Collection<String> keys) {
        Instant now = clock.instant();
        if (keys != null && !keys.isEmpty()) {
            repository.touch(new LinkedHashSet<>(keys), now);
        }
        return now;
    }

    /**
     * Drops the row only while it still points at {@code storagePath}, so a concurrent re-put survives.
     */
    public boolean deleteIfPathMatches(String key, String storagePath) {
        return repository.deleteByCacheKeyAndStoragePath(key, storagePath) > 0;
    }

    @Transactional(readOnly = true)
    public MediaCacheStats stats() {
        Map<MediaKind, MediaCacheStats.KindStats> byKind = new EnumMap<>(MediaKind.class);
        long files = 0;
        long bytes = 0;
        long analyzed = 0;
        for (MediaCacheEntryRepository.KindTotals totals : repository.totalsByKind()) {
            long kindFiles = asLong(totals.getFiles());
            long kindBytes = asLong(totals.getBytes());
            long kindAnalyzed = asLong(totals.getAnalyzed());
            byKind.put(totals.getKind(), new MediaCacheStats.KindStats(kindFiles, kindBytes, kindAnalyzed));
            files += kindFiles;
            bytes += kindBytes;
            analyzed += kindAnalyzed;
        }
        return new MediaCacheStats(
                files,
                bytes,
                analyzed,
                repository.countDistinctBrands(),
                repository.averageDuration(MediaKind.video),
                byKind
        );
    }

    private <T> T locked(Supplier<T> work) {
        writeLock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (RuntimeException ex) {
            if (ex instanceof MediaStorageException) {
                throw ex;
            }
            throw new MediaStorageException("Media cache metadata write failed", ex);
        } finally {
            writeLock.unlock();
        }
    }

    private MediaCacheEntryEntity toEntity(MediaCacheRecord record, Instant now) {
        MediaCacheEntryEntity entity = new MediaCacheEntryEntity(
                record.key(),
                record.originalUrl(),
                record.storagePath(),
                record.kind(),
                record.contentType(),
                record.sizeBytes(),
                now,
                now,
                record.brandName(),
                record.adId(),
                record.durationSeconds(),
                record.hasAudio()
        );
        if (record.analysis() != null) {
            applyAnalysis(entity, record.analysis(), now);
        }
        return entity;
    }

    private void applyAnalysis(MediaCacheEntryEntity entity, JsonNode analysis, Instant at) {
        try {
            entity.setAnalysisJson(objectMapper.writeValueAsString(analysis));
        } catch (JsonProcessingException e) {
            throw new MediaStorageException("Failed to serialize analysis for " + entity.getCacheKey(), e);
        }
        entity.setAnalysisCachedAt(at);
        entity.setDominantColors(writeList(AnalysisFields.dominantColors(analysis)));
        entity.setHasPeople(AnalysisFields.hasPeople(analysis));
        entity.setTextElements(writeList(AnalysisFields.textElements(analysis)));
    }

    private CachedMedia toModel(MediaCacheEntryEntity entity) {
        return new CachedMedia(
                entity.getCacheKey(),
                entity.getOriginalUrl(),
                entity.getStoragePath(),
                entity.getMediaKind(),
                entity.getContentType(),
                entity.getSizeBytes(),
                entity.getCreatedAt(),
                entity.getLastAccessedAt(),
                entity.getBrandName(),
                entity.getAdId(),
                parseAnalysis(entity),
                entity.getAnalysisCachedAt(),
                readList(entity, entity.getDominantColors()),
                entity.getHasPeople(),
                readList(entity, entity.getTextElements()),
                entity.getDurationSeconds(),
                entity.getHasAudio()
        );
    }

    private JsonNode parseAnalysis(MediaCacheEntryEntity entity) {
        String json = entity.getAnalysisJson();
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring corrupt analysis payload for cache key {}: {}", entity.getCacheKey(), e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Quick-filter lists are stored as JSON arrays so values may contain any separator.
     */
    private String writeList(List<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new MediaStorageException("Failed to serialize quick-filter values", e);
        }
    }

    private List<String> readList(MediaCacheEntryEntity entity, String stored) {
        if (stored == null || stored.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(stored, STRING_LIST).stream().filter(Objects::nonNull).toList();
        } catch (JsonProcessingException e) {
            log.warn("Ignoring corrupt quick-filter column for cache key {}: {}", entity.getCacheKey(), e.getOriginalMessage());
            return List.of();
        }
    }

    private static long asLong(Number value) {
        return value == null ? 0L : value.longValue();
    }
}
