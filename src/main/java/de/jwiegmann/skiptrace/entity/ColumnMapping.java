package de.jwiegmann.skiptrace.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Zuordnung einer Quellspalte zu einem Zielfeld. {@code field == null} bedeutet SKIP.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ColumnMapping {

    /** 0-basiert. */
    private int columnIndex;

    private String header;

    @Builder.Default
    private List<String> sampleValues = new ArrayList<>();

    private CanonicalField field;

    @Builder.Default
    private MappingSuggestion suggestion = MappingSuggestion.NONE;

    public boolean isSkipped() {
        return field == null;
    }
}
