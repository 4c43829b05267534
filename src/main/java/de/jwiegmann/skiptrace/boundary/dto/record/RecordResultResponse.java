package de.jwiegmann.skiptrace.boundary.dto.record;

import de.jwiegmann.skiptrace.entity.CanonicalRecord;
import de.jwiegmann.skiptrace.entity.ContactMetadata;
import de.jwiegmann.skiptrace.entity.EnrichmentSource;
import de.jwiegmann.skiptrace.entity.LitigatorType;
import de.jwiegmann.skiptrace.entity.PipelineResult;
import de.jwiegmann.skiptrace.entity.RecordStage;
import de.jwiegmann.skiptrace.entity.RowValidationError;
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
public class RecordResultResponse {
    private String recordId;
    private int rowNumber;
    private Integer duplicateOfRow;
    private PipelineResult result;
    private Set<RecordStage> completedStages;
    private EnrichmentSource enrichmentSource;
    private CanonicalRecord record;
    private ContactMetadata contact;
    private String matchedLitigatorId;
    private LitigatorType matchedLitigatorType;
    private List<String> tags;
    private int attempts;
    private String errorMessage;
    private RowValidationError rowError;
}
