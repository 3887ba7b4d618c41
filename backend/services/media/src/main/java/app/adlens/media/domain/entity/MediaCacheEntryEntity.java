package app.adlens.media.domain.entity;

import app.adlens.media.domain.type.MediaKind;
import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "media_cache")
public class MediaCacheEntryEntity {

    @Id
    @Column(name = "cache_key", nullable = false, length = 32)
    private String cacheKey;

    @Column(name = "original_url", nullable = false, length = 4096)
    private String originalUrl;

    @Column(name = "storage_path", nullable = false, length = 1024)
    private String storagePath;

    @Enumerated(EnumType.STRING)
    @Column(name = "media_kind", nullable = false, length = 16)
    private MediaKind mediaKind;

    @Column(name = "content_type")
    private String contentType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_accessed_at", nullable = false)
    private Instant lastAccessedAt;

    @Column(name = "brand_name", length = 512)
    private String brandName;

    @Column(name = "ad_id", length = 128)
    private String adId;

    @Lob
    @Column(name = "analysis_results")
    private String analysisJson;

    @Column(name = "analysis_cached_at")
    private Instant analysisCachedAt;

    @Column(name = "dominant_colors", length = 1024)
    private String dominantColors;

    @Column(name = "has_people")
    private Boolean hasPeople;

    @Lob
    @Column(name = "text_elements")
    private String textElements;

    @Column(name = "duration_seconds")
    private Double durationSeconds;

    @Column(name = "has_audio")
    private Boolean hasAudio;

    protected MediaCacheEntryEntity() {
    }

    public MediaCacheEntryEntity(String cacheKey,
                                 String originalUrl,
                                 String storagePath,
                                 MediaKind mediaKind,
                                 String contentType,
                                 long sizeBytes,
                                 Instant createdAt,
                                 Instant lastAccessedAt,
                                 String brandName,
                                 String adId,
                                 Double durationSeconds,
                                 Boolean hasAudio) {
        this.cacheKey = cacheKey;
        this.originalUrl = originalUrl;
        this.storagePath = storagePath;
        this.mediaKind = mediaKind;
        this.contentType = contentType;
        this.sizeBytes = sizeBytes;
        this.createdAt = createdAt;
        this.lastAccessedAt = lastAccessedAt;
        this.brandName = brandName;
        this.adId = adId;
        this.durationSeconds = durationSeconds;
        this.hasAudio = hasAudio;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public void setCacheKey(String cacheKey) {
        this.cacheKey = cacheKey;
    }

    public String getOriginalUrl() {
        return originalUrl;
    }

    public void setOriginalUrl(String originalUrl) {
        this.originalUrl = originalUrl;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(String storagePath) {
        this.storagePath = storagePath;
    }

    public MediaKind getMediaKind() {
        return mediaKind;
    }

    public void setMediaKind(MediaKind mediaKind) {
        this.mediaKind = mediaKind;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }

    public void setLastAccessedAt(Instant lastAccessedAt) {
        this.lastAccessedAt = lastAccessedAt;
    }

    public String getBrandName() {
        return brandName;
    }

    public void setBrandName(String brandName) {
        this.brandName = brandName;
    }

    public String getAdId() {
        return adId;
    }

    public void setAdId(String adId) {
        this.adId = adId;
    }

    public String getAnalysisJson() {
        return analysisJson;
    }

    public void setAnalysisJson(String analysisJson) {
        this.analysisJson = analysisJson;
    }

    public Instant getAnalysisCachedAt() {
        return analysisCachedAt;
    }

    public void setAnalysisCachedAt(Instant analysisCachedAt) {
        this.analysisCachedAt = analysisCachedAt;
    }

    public String getDominantColors() {
        return dominantColors;
    }

    public void setDominantColors(String dominantColors) {
        this.dominantColors = dominantColors;
    }

    public Boolean getHasPeople() {
        return hasPeople;
    }

    public void setHasPeople(Boolean hasPeople) {
        this.hasPeople = hasPeople;
    }

    public String getTextElements() {
        return textElements;
    }

    public void setTextElements(String textElements) {
        this.textElements = textElements;
    }

    public Double getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(Double durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public Boolean getHasAudio() {
        return hasAudio;
    }

    public void setHasAudio(Boolean hasAudio) {
        this.hasAudio = hasAudio;
    }
}
