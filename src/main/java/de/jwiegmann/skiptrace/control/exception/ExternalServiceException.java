package de.jwiegmann.skiptrace.control.exception;

import lombok.Getter;

/**
 * Der Skip-Trace-Anbieter war nicht erreichbar oder hat abgelehnt. Gilt als vorübergehend und wird wiederholt.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    public enum Reason {
        TIMEOUT,
        RATE_LIMITED,
        SERVICE_ERROR
    }

    private final Reason reason;

    public ExternalServiceException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ExternalServiceException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
