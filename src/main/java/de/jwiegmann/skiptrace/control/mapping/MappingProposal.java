package de.jwiegmann.skiptrace.control.mapping;

import de.jwiegmann.skiptrace.entity.ColumnMapping;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingProposal {

    private boolean hasHeaderRow;
    private int columnCount;

    @Builder.Default
    private List<ColumnMapping> columns = new ArrayList<>();
}
