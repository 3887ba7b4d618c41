package app.adlens.media.service.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class MediaFetchException extends RuntimeException {
    public MediaFetchException(String message) {
        super(message);
    }

    public MediaFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
