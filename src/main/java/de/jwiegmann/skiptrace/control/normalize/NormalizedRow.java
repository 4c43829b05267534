package de.jwiegmann.skiptrace.control.normalize;

import de.jwiegmann.skiptrace.entity.CanonicalRecord;
import de.jwiegmann.skiptrace.entity.RowValidationError;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Eine Datenzeile nach der Normalisierung: entweder ein Datensatz oder ein Zeilenfehler.
 */
@Getter
@AllArgsConstructor
public class NormalizedRow {

    private final int rowNumber;
    private final CanonicalRecord record;
    private final RowValidationError error;

    public static NormalizedRow valid(CanonicalRecord record) {
        return new NormalizedRow(record.getRowNumber(), record, null);
    }

    public static NormalizedRow rejected(RowValidationError error) {
        return new NormalizedRow(error.getRowNumber(), null, error);
    }

    public boolean isValid() {
        return error == null;
    }
}
