package app.adlens.media.provider.gemini;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.ai.gemini")
public record GeminiProps(
        String baseUrl,
        String apiKey,
        String model,
        Long inlineLimitBytes,
        Duration filePollInterval,
        Integer filePollAttempts
) {
    public long inlineLimitOrDefault() {
        return inlineLimitBytes == null ? 15L * 1024 * 1024 : inlineLimitBytes;
    }

    public Duration pollIntervalOrDefault() {
        return filePollInterval == null ? Duration.ofSeconds(2) : filePollInterval;
    }

    public int pollAttemptsOrDefault() {
        return filePollAttempts == null || filePollAttempts <= 0 ? 60 : filePollAttempts;
    }
}
