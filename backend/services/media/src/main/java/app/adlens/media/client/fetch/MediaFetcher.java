package app.adlens.media.client.fetch;

public interface MediaFetcher {
    FetchedMedia fetch(String url);
}
