package app.adlens.media.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Validated
@ConfigurationProperties(prefix = "app.media-cache")
public record MediaCacheProps(
        @NotBlank String rootDir,
        @Min(0) int maxAgeDays
) {
    public Path rootPath() {
        return Path.of(rootDir).toAbsolutePath().normalize();
    }

    public Path imagesDir() {
        return rootPath().resolve("images");
    }

    public Path videosDir() {
        return rootPath().resolve("videos");
    }
}
