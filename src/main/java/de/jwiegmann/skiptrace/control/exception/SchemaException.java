package de.jwiegmann.skiptrace.control.exception;

/**
 * Die Tabelle oder das bestätigte Mapping ist strukturell unbrauchbar. Der Upload wird abgewiesen.
 */
public class SchemaException extends UploadValidationException {

    public static final String CODE = "SCHEMA_INVALID";

    public SchemaException(String message) {
        super(CODE, message);
    }
}
