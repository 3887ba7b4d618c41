package app.adlens.media.controller;

import app.adlens.media.client.adlibrary.AdRecord;
import app.adlens.media.controller.dto.ImageAnalysisRequest;
import app.adlens.media.controller.dto.VideoAnalysisRequest;
import app.adlens.media.domain.model.MediaAnalysisResult;
import app.adlens.media.service.AdLibraryService;
import app.adlens.media.service.AdMediaAnalysisService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/ads")
public class AdMediaController {
    private final AdLibraryService adLibraryService;
    private final AdMediaAnalysisService analysisService;

    public AdMediaController(AdLibraryService adLibraryService, AdMediaAnalysisService analysisService) {
        this.adLibraryService = adLibraryService;
        this.analysisService = analysisService;
    }

    @GetMapping("/brands/{brand}/platform-ids")
    public Map<String, String> platformIds(@PathVariable String brand) {
        return adLibraryService.platformIds(brand);
    }

    @GetMapping("/brands/{brand}/ads")
    public List<AdRecord> brandAds(@PathVariable String brand,
                                   @RequestParam(defaultValue = "50") int limit,
                                   @RequestParam(required = false) String country) {
        return adLibraryService.adsForBrand(brand, limit, country);
    }

    @GetMapping("/search")
    public List<AdRecord> search(@RequestParam String query,
                                 @RequestParam(defaultValue = "50") int limit,
                                 @RequestParam(required = false) String country) {
        return adLibraryService.searchAds(query, limit, country);
    }

    @PostMapping("/media/images/analyze")
    public List<MediaAnalysisResult> analyzeImages(@Valid @RequestBody ImageAnalysisRequest request) {
        return analysisService.analyzeImages(request.urls(), request.brandName(), request.adId());
    }

    @PostMapping("/media/videos/analyze")
    public List<MediaAnalysisResult> analyzeVideos(@Valid @RequestBody VideoAnalysisRequest request) {
        return analysisService.analyzeVideos(request.urls(), request.brandNames(), request.adIds());
    }
}
