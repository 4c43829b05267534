package de.jwiegmann.skiptrace.boundary.dto.mapping;

import de.jwiegmann.skiptrace.entity.RefreshPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappingConfirmRequest {
    private List<ColumnAssignment> assignments;
    private RefreshPolicy refreshPolicy;
    private List<String> tags;
}
