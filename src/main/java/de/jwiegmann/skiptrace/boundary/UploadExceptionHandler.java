package de.jwiegmann.skiptrace.boundary;

import de.jwiegmann.skiptrace.boundary.dto.error.UploadError;
import de.jwiegmann.skiptrace.control.UploadErrorFactory;
import de.jwiegmann.skiptrace.control.exception.FieldConflictException;
import de.jwiegmann.skiptrace.control.exception.UploadValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class UploadExceptionHandler {

    @ExceptionHandler(FieldConflictException.class)
    public ResponseEntity<UploadError> fieldConflict(FieldConflictException ex) {
        log.debug("Mapping-Konflikt: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(UploadErrorFactory.fieldConflict(ex));
    }

    @ExceptionHandler(UploadValidationException.class)
    public ResponseEntity<UploadError> validation(UploadValidationException ex) {
        log.debug("Upload abgewiesen: {} {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(UploadErrorFactory.fromException(ex));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<UploadError> unreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(UploadErrorFactory.validationFailed(ex.getMostSpecificCause().getMessage()));
    }
}
