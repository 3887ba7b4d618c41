package app.adlens.media.client.fetch;

public record FetchedMedia(byte[] bytes, String contentType) {
}
