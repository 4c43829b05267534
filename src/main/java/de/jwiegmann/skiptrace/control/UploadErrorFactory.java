package de.jwiegmann.skiptrace.control;

import de.jwiegmann.skiptrace.boundary.dto.error.UploadError;
import de.jwiegmann.skiptrace.control.exception.FieldConflictException;
import de.jwiegmann.skiptrace.control.exception.UploadValidationException;

import java.util.Map;

public final class UploadErrorFactory {

    private UploadErrorFactory() {
    }

    public static UploadError validationFailed(String details) {
        return UploadError.builder()
                .code("VALIDATION_FAILED")
                .message("Request validation failed: " + details)
                .details(Map.of("details", details))
                .build();
    }

    public static UploadError fromException(UploadValidationException ex) {
        if (ex instanceof FieldConflictException) {
            return fieldConflict((FieldConflictException) ex);
        }
        return UploadError.builder()
                .code(ex.getErrorCode())
                .message(ex.getMessage())
                .build();
    }

    public static UploadError fieldConflict(FieldConflictException ex) {
        return UploadError.builder()
                .code(FieldConflictException.CODE)
                .message(ex.getMessage())
                .details(Map.of(
                        "field", ex.getField().name(),
                        "columnIndex", ex.getColumnIndex(),
                        "occupiedByColumn", ex.getOccupiedByColumn()))
                .build();
    }
}
