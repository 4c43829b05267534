package de.jwiegmann.skiptrace.boundary.dto.status;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.jwiegmann.skiptrace.entity.BatchStatus;
import de.jwiegmann.skiptrace.entity.RefreshPolicy;
import de.jwiegmann.skiptrace.entity.RowValidationError;
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
public class UploadStatusResponse {
    private String batchId;
    private String ownerId;
    private String filename;
    private BatchStatus status;
    private RefreshPolicy refreshPolicy;
    private List<String> tags;
    private boolean running;
    private int runCount;
    private String errorMessage;

    @JsonProperty("processed_count")
    private int processedCount;          // Datensätze mit Ergebnis
    @JsonProperty("total_count")
    private int totalCount;              // nicht-leere Datenzeilen
    @JsonProperty("failed_count")
    private int failedCount;             // failed_external, beim Resume erneut versucht

    private int succeeded;               // enriched_from_cache + enriched_fresh
    private int skipped;                 // skipped_invalid inkl. Zeilenfehler
    private int litigators;              // matched_litigator ohne Wiederholungen
    private int duplicates;              // Zeilen, die eine frühere Zeile wiederholen

    private HitStatistics hits;
    private List<RowValidationError> rowErrors;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
}
