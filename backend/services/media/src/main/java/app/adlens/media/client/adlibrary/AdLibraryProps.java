package app.adlens.media.client.adlibrary;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.ad-library")
public record AdLibraryProps(
        String baseUrl,
        String apiKey
) {
}
