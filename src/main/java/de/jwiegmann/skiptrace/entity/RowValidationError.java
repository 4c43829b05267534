package de.jwiegmann.skiptrace.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fehler einer einzelnen Zeile. Die Zeile wird übersprungen, der Upload läuft weiter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RowValidationError {

    public static final String FIELD_TOO_LONG = "FIELD_TOO_LONG";

    /** 1-basiert über die Datenzeilen. */
    private int rowNumber;

    private CanonicalField field;

    /** 1-basiert, wie in der Tabellenansicht. */
    private int columnNumber;

    private String code;
    private String message;
}
