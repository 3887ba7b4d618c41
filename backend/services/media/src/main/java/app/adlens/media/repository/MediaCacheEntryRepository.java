package app.adlens.media.repository;

import app.adlens.media.domain.entity.MediaCacheEntryEntity;
import app.adlens.media.domain.type.MediaKind;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface MediaCacheEntryRepository extends JpaRepository<MediaCacheEntryEntity, String> {

    interface KindTotals {
        MediaKind getKind();

        Number getFiles();

        Number getBytes();

        Number getAnalyzed();
    }

    List<MediaCacheEntryEntity> findByCacheKeyIn(Collection<String> cacheKeys);

    List<MediaCacheEntryEntity> findByCreatedAtBefore(Instant cutoff);

    @Query("""
        select e from MediaCacheEntryEntity e
        where (:brandName is null or e.brandName = :brandName)
          and (:hasPeople is null or e.hasPeople = :hasPeople)
          and (:color is null or lower(e.dominantColors) like concat('%', :color, '%'))
          and (:kind is null or e.mediaKind = :kind)
        order by e.lastAccessedAt desc
        """)
    List<MediaCacheEntryEntity> search(@Param("brandName") String brandName,
                                       @Param("hasPeople") Boolean hasPeople,
                                       @Param("color") String lowerCaseColor,
                                       @Param("kind") MediaKind kind,
                                       Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update MediaCacheEntryEntity e set e.lastAccessedAt = :now where e.cacheKey in :keys")
    int touch(@Param("keys") Collection<String> keys, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("delete from MediaCacheEntryEntity e where e.cacheKey = :key and e.storagePath = :path")
    int deleteByCacheKeyAndStoragePath(@Param("key") String key, @Param("path") String storagePath);

    @Query("""
        select e.mediaKind as kind,
               count(e) as files,
               coalesce(sum(e.sizeBytes), 0) as bytes,
               sum(case when e.analysisCachedAt is not null then 1 else 0 end) as analyzed
        from MediaCacheEntryEntity e
        group by e.mediaKind
        """)
    List<KindTotals> totalsByKind();

    @Query("select count(distinct e.brandName) from MediaCacheEntryEntity e where e.brandName is not null")
    long countDistinctBrands();

    @Query("""
        select avg(e.durationSeconds) from MediaCacheEntryEntity e
        where e.mediaKind = :kind and e.durationSeconds is not null
        """)
    Double averageDuration(@Param("kind") MediaKind kind);
}
