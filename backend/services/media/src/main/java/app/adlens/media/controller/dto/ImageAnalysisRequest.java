package app.adlens.media.controller.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record ImageAnalysisRequest(
        @NotEmpty List<String> urls,
        String brandName,
        String adId
) {
}
