package de.jwiegmann.skiptrace.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Verarbeitungszustand einer Datenzeile. Wird nur vom Worker geschrieben, der den Datensatz gerade hält.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkipTraceRecord {

    private String recordId;
    private String batchId;
    private int rowNumber;

    private CanonicalRecord canonical;
    private RowValidationError rowError;

    /** Zeilennummer des ersten identischen Datensatzes im selben Upload, sonst null. */
    private Integer duplicateOfRow;

    @Builder.Default
    private Set<RecordStage> completedStages = EnumSet.noneOf(RecordStage.class);

    private EnrichmentSource enrichmentSource;
    private ContactMetadata contact;

    private String matchedLitigatorId;
    private LitigatorType matchedLitigatorType;

    private volatile PipelineResult result;
    private String errorMessage;
    private int attempts;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private LocalDateTime updatedAt;

    public static String recordId(String batchId, int rowNumber) {
        return batchId + ":" + rowNumber;
    }

    public boolean hasCompleted(RecordStage stage) {
        return completedStages.contains(stage);
    }

    public void complete(RecordStage stage) {
        completedStages.add(stage);
        updatedAt = LocalDateTime.now();
    }

    public boolean isDuplicate() {
        return duplicateOfRow != null;
    }

    /** Noch offen oder durch Ausfall des Anbieters hängen geblieben. */
    public boolean isPending() {
        return result == null || result == PipelineResult.FAILED_EXTERNAL;
    }
}
