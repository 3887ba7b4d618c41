package app.adlens.media.service.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class CacheEntryNotFoundException extends RuntimeException {
    private final String url;

    public CacheEntryNotFoundException(String url) {
        super("No cached media for url: " + url);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
