package de.jwiegmann.skiptrace.control.pipeline;

import de.jwiegmann.skiptrace.control.enrichment.EnrichmentDecision;
import de.jwiegmann.skiptrace.control.enrichment.EnrichmentDecisionEngine;
import de.jwiegmann.skiptrace.control.enrichment.EnrichmentRun;
import de.jwiegmann.skiptrace.control.exception.ExternalServiceException;
import de.jwiegmann.skiptrace.control.litigator.LitigatorMatch;
import de.jwiegmann.skiptrace.control.litigator.LitigatorMatcher;
import de.jwiegmann.skiptrace.control.tag.TagApplier;
import de.jwiegmann.skiptrace.entity.EnrichmentSource;
import de.jwiegmann.skiptrace.entity.PipelineResult;
import de.jwiegmann.skiptrace.entity.RecordStage;
import de.jwiegmann.skiptrace.entity.SkipTraceRecord;
import de.jwiegmann.skiptrace.entity.UploadBatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Führt die Stufen Enrich -> Match -> Tag für einen Datensatz aus.
 * Bereits abgeschlossene Stufen werden übersprungen, ein angereicherter Datensatz wird nie erneut abgefragt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecordPipeline {

    private final EnrichmentDecisionEngine decisionEngine;
    private final LitigatorMatcher litigatorMatcher;
    private final TagApplier tagApplier;

    public PipelineResult process(SkipTraceRecord record, UploadBatch batch, EnrichmentRun run) {

        // 1. Decide/Enrich
        ExternalServiceException enrichmentFailure = null;
        if (!record.hasCompleted(RecordStage.ENRICHED)) {
            try {
                EnrichmentDecision decision = decisionEngine.decide(record.getCanonical(), run,
                        () -> record.setAttempts(record.getAttempts() + 1));
                record.setEnrichmentSource(decision.getSource());
                record.setContact(decision.getContact());
                record.complete(RecordStage.ENRICHED);
            } catch (ExternalServiceException e) {
                enrichmentFailure = e;
            }
        }

        // 2. Match (hat Vorrang vor der Anreicherung, läuft auch nach einem Anbieterfehler auf den eingereichten Daten)
        if (!record.hasCompleted(RecordStage.MATCHED)) {
            LitigatorMatch match = litigatorMatcher.match(record.getCanonical(), record.getContact());
            if (match.isMatched()) {
                record.setMatchedLitigatorId(match.getLitigator().getLitigatorId());
                record.setMatchedLitigatorType(match.getLitigator().getType());
            }
            // ohne Anreicherung fehlen noch die gelieferten Rufnummern
            if (enrichmentFailure == null || match.isMatched()) {
                record.complete(RecordStage.MATCHED);
            }
        }

        if (enrichmentFailure != null && record.getMatchedLitigatorId() == null) {
            record.setErrorMessage(enrichmentFailure.getReason() + ": " + enrichmentFailure.getMessage());
            record.setResult(PipelineResult.FAILED_EXTERNAL);
            return PipelineResult.FAILED_EXTERNAL;
        }

        PipelineResult result = resultOf(record);

        // 3. Tag
        tagApplier.apply(record, result, batch.getTags());

        record.setErrorMessage(null);
        record.setResult(result);
        return result;
    }

    static PipelineResult resultOf(SkipTraceRecord record) {
        if (record.getMatchedLitigatorId() != null) {
            return PipelineResult.MATCHED_LITIGATOR;
        }
        if (record.getEnrichmentSource() == EnrichmentSource.CACHE) {
            return PipelineResult.ENRICHED_FROM_CACHE;
        }
        if (record.getEnrichmentSource() == EnrichmentSource.FRESH) {
            return PipelineResult.ENRICHED_FRESH;
        }
        return PipelineResult.SKIPPED_INVALID;
    }
}
