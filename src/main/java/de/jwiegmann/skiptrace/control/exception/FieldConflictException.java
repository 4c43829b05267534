package de.jwiegmann.skiptrace.control.exception;

import de.jwiegmann.skiptrace.entity.CanonicalField;
import lombok.Getter;

/**
 * Ein exklusives Zielfeld ist bereits einer anderen Spalte zugeordnet (bzw. alle Telefon-Slots sind belegt).
 */
@Getter
public class FieldConflictException extends UploadValidationException {

    public static final String CODE = "FIELD_CONFLICT";

    private final CanonicalField field;
    private final int columnIndex;
    private final int occupiedByColumn;

    public FieldConflictException(CanonicalField field, int columnIndex, int occupiedByColumn) {
        super(CODE, "field " + field + " is already assigned to column " + occupiedByColumn);
        this.field = field;
        this.columnIndex = columnIndex;
        this.occupiedByColumn = occupiedByColumn;
    }
}
