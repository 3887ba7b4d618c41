package app.adlens.media.client.adlibrary;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class AdLibraryException extends RuntimeException {
    public enum Reason {
        credits_exhausted,
        rate_limited,
        upstream_error
    }

    private final Reason reason;

    public AdLibraryException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AdLibraryException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
