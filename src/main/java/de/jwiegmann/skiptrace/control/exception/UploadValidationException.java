package de.jwiegmann.skiptrace.control.exception;

import lombok.Getter;

/**
 * Fachlicher Fehler beim Anlegen oder Mappen eines Uploads. Der Code landet unverändert im {@code UploadError}.
 */
@Getter
public class UploadValidationException extends RuntimeException {

    private final String errorCode;

    public UploadValidationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
