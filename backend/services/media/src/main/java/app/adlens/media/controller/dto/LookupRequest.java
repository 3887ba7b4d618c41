package app.adlens.media.controller.dto;

import app.adlens.media.domain.type.MediaKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record LookupRequest(
        @NotEmpty List<@NotBlank String> urls,
        MediaKind kind
) {
}
