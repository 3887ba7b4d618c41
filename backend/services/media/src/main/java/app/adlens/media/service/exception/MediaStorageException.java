package app.adlens.media.service.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Blob or metadata write failed. Not retried.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class MediaStorageException extends RuntimeException {
    public MediaStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
