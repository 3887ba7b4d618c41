package app.adlens.media.controller.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * {@code brandNames} and {@code adIds} are optional and aligned with {@code urls} by position.
 */
public record VideoAnalysisRequest(
        @NotEmpty List<String> urls,
        List<String> brandNames,
        List<String> adIds
) {
}
