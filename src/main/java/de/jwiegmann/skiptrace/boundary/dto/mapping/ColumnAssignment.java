package de.jwiegmann.skiptrace.boundary.dto.mapping;

import de.jwiegmann.skiptrace.entity.CanonicalField;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bestätigte Zuordnung einer Spalte; {@code field == null} bedeutet SKIP.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ColumnAssignment {
    private int columnIndex;
    private CanonicalField field;
}
