package app.adlens.media.controller;

import app.adlens.media.controller.dto.CacheStatsResponse;
import app.adlens.media.controller.dto.LookupRequest;
import app.adlens.media.controller.dto.LookupResult;
import app.adlens.media.domain.model.CachedMedia;
import app.adlens.media.domain.model.EvictionReport;
import app.adlens.media.domain.model.MediaSearchFilter;
import app.adlens.media.domain.type.MediaKind;
import app.adlens.media.service.MediaCacheService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/cache")
public class MediaCacheController {
    private final MediaCacheService cacheService;

    public MediaCacheController(MediaCacheService cacheService) {
        this.cacheService = cacheService;
    }

    @GetMapping("/stats")
    public CacheStatsResponse stats() {
        return CacheStatsResponse.from(cacheService.stats());
    }

    @GetMapping("/entries")
    public List<CachedMedia> search(@RequestParam(required = false) String brandName,
                                    @RequestParam(required = false) Boolean hasPeople,
                                    @RequestParam(required = false) String color,
                                    @RequestParam(required = false) MediaKind kind,
                                    @RequestParam(defaultValue = "20") int limit) {
        return cacheService.search(new MediaSearchFilter(brandName, hasPeople, color, kind, limit));
    }

    @PostMapping("/lookup")
    public List<LookupResult> lookup(@Valid @RequestBody LookupRequest request) {
        List<String> urls = request.urls().stream().map(String::trim).toList();
        return cacheService.getCachedBatch(urls, request.kind()).entrySet().stream()
                .map(entry -> new LookupResult(entry.getKey(), entry.getValue().isPresent(),
                        entry.getValue().orElse(null)))
                .toList();
    }

    @PostMapping("/cleanup")
    public EvictionReport cleanup(@RequestParam(required = false) Integer maxAgeDays) {
        return maxAgeDays == null ? cacheService.evictExpired() : cacheService.evictOlderThan(maxAgeDays);
    }
}
