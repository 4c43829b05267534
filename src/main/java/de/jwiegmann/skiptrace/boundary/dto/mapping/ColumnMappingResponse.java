package de.jwiegmann.skiptrace.boundary.dto.mapping;

import de.jwiegmann.skiptrace.entity.CanonicalField;
import de.jwiegmann.skiptrace.entity.MappingSuggestion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnMappingResponse {
    private int columnIndex;
    private String header;
    private List<String> sampleValues;
    private CanonicalField field;                // null = SKIP
    private MappingSuggestion suggestion;
    private Set<CanonicalField> disabledFields;  // in der Auswahl ausgegraut
}
