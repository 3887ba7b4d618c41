package app.adlens.media.client.fetch;

import app.adlens.media.service.exception.MediaFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;

@Component
public class RestClientMediaFetcher implements MediaFetcher {
    private static final Logger log = LoggerFactory.getLogger(RestClientMediaFetcher.class);

    private final RestClient restClient;

    public RestClientMediaFetcher(RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.build();
    }

    @Override
    public FetchedMedia fetch(String url) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException ex) {
            throw new MediaFetchException("Invalid media url: " + url, ex);
        }
        try {
            ResponseEntity<byte[]> response = restClient.get()
                    .uri(uri)
                    .retrieve()
                    .toEntity(byte[].class);
            byte[] body = response.getBody();
            if (body == null || body.length == 0) {
                throw new MediaFetchException("Empty response body for " + url);
            }
            String contentType = response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
            log.debug("Fetched {} bytes ({}) from {}", body.length, contentType, url);
            return new FetchedMedia(body, contentType);
        } catch (RestClientException ex) {
            throw new MediaFetchException("Failed to download " + url + ": " + ex.getMessage(), ex);
        }
    }
}
