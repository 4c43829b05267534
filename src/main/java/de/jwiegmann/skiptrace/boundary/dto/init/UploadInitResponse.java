package de.jwiegmann.skiptrace.boundary.dto.init;

import de.jwiegmann.skiptrace.boundary.dto.mapping.ColumnMappingResponse;
import de.jwiegmann.skiptrace.entity.BatchStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadInitResponse {
    private String batchId;
    private BatchStatus status;
    private boolean hasHeaderRow;
    private int totalRows;
    private int phoneSlots;
    private List<ColumnMappingResponse> columns;   // Mapping-Vorschlag zur Bestätigung
    private LocalDateTime createdAt;
}
