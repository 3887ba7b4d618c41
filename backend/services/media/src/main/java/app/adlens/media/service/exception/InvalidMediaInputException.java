package app.adlens.media.service.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidMediaInputException extends RuntimeException {
    public InvalidMediaInputException(String message) {
        super(message);
    }
}
