package app.adlens.media.client.fetch;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.fetch")
public record FetchProps(
        Duration connectTimeout,
        Duration readTimeout
) {
    public FetchProps {
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(10);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(30);
        }
    }
}
