package de.jwiegmann.skiptrace.control;

import de.jwiegmann.skiptrace.boundary.dto.init.UploadInitRequest;
import de.jwiegmann.skiptrace.boundary.dto.init.UploadInitResponse;
import de.jwiegmann.skiptrace.boundary.dto.mapping.ColumnMappingResponse;
import de.jwiegmann.skiptrace.boundary.dto.mapping.MappingConfirmRequest;
import de.jwiegmann.skiptrace.boundary.dto.record.RecordListResponse;
import de.jwiegmann.skiptrace.boundary.dto.record.RecordResultResponse;
import de.jwiegmann.skiptrace.boundary.dto.status.HitStatistics;
import de.jwiegmann.skiptrace.boundary.dto.status.UploadStatusListResponse;
import de.jwiegmann.skiptrace.boundary.dto.status.UploadStatusResponse;
import de.jwiegmann.skiptrace.control.exception.SchemaException;
import de.jwiegmann.skiptrace.control.exception.UploadValidationException;
import de.jwiegmann.skiptrace.control.mapping.MappingProposal;
import de.jwiegmann.skiptrace.control.mapping.SchemaMapper;
import de.jwiegmann.skiptrace.control.normalize.RecordNormalizer;
import de.jwiegmann.skiptrace.control.pipeline.PipelineOrchestrator;
import de.jwiegmann.skiptrace.control.repository.SkipTraceRecordRepository;
import de.jwiegmann.skiptrace.control.repository.UploadBatchRepository;
import de.jwiegmann.skiptrace.entity.BatchStatus;
import de.jwiegmann.skiptrace.entity.ColumnMapping;
import de.jwiegmann.skiptrace.entity.ContactMetadata;
import de.jwiegmann.skiptrace.entity.EnrichmentSource;
import de.jwiegmann.skiptrace.entity.PipelineResult;
import de.jwiegmann.skiptrace.entity.RecordStage;
import de.jwiegmann.skiptrace.entity.RefreshPolicy;
import de.jwiegmann.skiptrace.entity.RowValidationError;
import de.jwiegmann.skiptrace.entity.SkipTraceRecord;
import de.jwiegmann.skiptrace.entity.UploadBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Einstiegspunkt der Boundary: Upload anlegen, Mapping bestätigen, Verarbeitung anstoßen, Status abfragen.
 */
@Slf4j
@Service
public class UploadService {

    private final UploadBatchRepository batchRepository;
    private final SkipTraceRecordRepository recordRepository;
    private final SchemaMapper schemaMapper;
    private final PipelineOrchestrator orchestrator;
    private final Executor batchRunner;
    private final int maxRows;
    private final boolean autoStart;

    public UploadService(UploadBatchRepository batchRepository,
                         SkipTraceRecordRepository recordRepository,
                         SchemaMapper schemaMapper,
                         PipelineOrchestrator orchestrator,
                         @Qualifier("batchRunnerPool") Executor batchRunner,
                         @Value("${upload.max-rows:10000}") int maxRows,
                         @Value("${upload.processing.auto-start:true}") boolean autoStart) {
        this.batchRepository = batchRepository;
        this.recordRepository = recordRepository;
        this.schemaMapper = schemaMapper;
        this.orchestrator = orchestrator;
        this.batchRunner = batchRunner;
        this.maxRows = maxRows;
        this.autoStart = autoStart;
    }

    /**
     * Legt einen Upload an und liefert den Mapping-Vorschlag.
     *
     * @param req Tabelle und Metadaten
     * @return Upload im Status MAPPING mit Vorschlag pro Spalte
     * @throws SchemaException bei strukturell unbrauchbarer Tabelle
     */
    public UploadInitResponse createBatch(final UploadInitRequest req) {

        // 1. Metadaten prüfen
        if (req == null || req.getOwnerId() == null || req.getOwnerId().isBlank()) {
            throw new UploadValidationException("VALIDATION_FAILED", "ownerId is required");
        }
        if (req.getRows() == null || req.getRows().isEmpty()) {
            throw new SchemaException("upload contains no rows");
        }

        // 2. Mapping vorschlagen (prüft auch die Spaltenzahl)
        MappingProposal proposal = schemaMapper.propose(req.getRows(), req.getHasHeaderRow());
        int totalRows = RecordNormalizer.countDataRows(req.getRows(), proposal.isHasHeaderRow());
        if (totalRows > maxRows) {
            throw new SchemaException("upload has " + totalRows + " data rows, maximum is " + maxRows);
        }

        // 3. Upload persistieren
        UploadBatch batch = UploadBatch.builder()
                .batchId(UUID.randomUUID().toString())
                .ownerId(req.getOwnerId())
                .filename(req.getFilename())
                .rawRows(copyRows(req.getRows()))
                .hasHeaderRow(proposal.isHasHeaderRow())
                .columnMappings(proposal.getColumns())
                .refreshPolicy(req.getRefreshPolicy() == null ? RefreshPolicy.PREFER_CACHE : req.getRefreshPolicy())
                .status(BatchStatus.MAPPING)
                .totalRows(totalRows)
                .build();
        batchRepository.save(batch);
        log.info("Upload {} angelegt: {} Datenzeilen, {} Spalten, Header={}",
                batch.getBatchId(), totalRows, proposal.getColumnCount(), proposal.isHasHeaderRow());

        return UploadInitResponse.builder()
                .batchId(batch.getBatchId())
                .status(batch.getStatus())
                .hasHeaderRow(batch.isHasHeaderRow())
                .totalRows(totalRows)
                .phoneSlots(schemaMapper.getPhoneSlots())
                .columns(toColumnResponses(batch.getColumnMappings()))
                .createdAt(batch.getCreatedAt())
                .build();
    }

    /**
     * Übernimmt das bestätigte Mapping samt Policy und Tags und startet die Verarbeitung.
     *
     * @throws ResponseStatusException 404 wenn unbekannt, 409 wenn das Mapping schon bestätigt wurde
     */
    public UploadStatusResponse confirmMapping(String batchId, MappingConfirmRequest req) {
        UploadBatch batch = findBatch(batchId);
        if (batch.getStatus() != BatchStatus.MAPPING) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "mapping already confirmed");
        }
        if (req == null) {
            throw new UploadValidationException("VALIDATION_FAILED", "mapping confirmation is required");
        }

        List<ColumnMapping> confirmed = schemaMapper.confirm(batch.getColumnMappings(), req.getAssignments());
        if (confirmed.stream().allMatch(ColumnMapping::isSkipped)) {
            throw new SchemaException("at least one column must be mapped");
        }

        batch.setColumnMappings(confirmed);
        if (req.getRefreshPolicy() != null) {
            batch.setRefreshPolicy(req.getRefreshPolicy());
        }
        batch.setTags(req.getTags() == null ? new ArrayList<>() : new ArrayList<>(req.getTags()));
        batch.setStatus(BatchStatus.PROCESSING);
        batchRepository.save(batch);
        log.info("Mapping für Upload {} bestätigt: {} Spalten zugeordnet, Policy {}, Tags {}", batchId,
                confirmed.stream().filter(c -> !c.isSkipped()).count(), batch.getRefreshPolicy(), batch.getTags());

        if (autoStart) {
            batchRunner.execute(() -> runInBackground(batchId));
        }
        return buildStatusResponse(batch);
    }

    /**
     * Startet oder setzt die Verarbeitung synchron fort. Wiederholte Aufrufe sind unschädlich.
     */
    public UploadStatusResponse process(String batchId) {
        return buildStatusResponse(orchestrator.process(batchId));
    }

    public UploadStatusResponse cancel(String batchId) {
        return buildStatusResponse(orchestrator.cancel(batchId));
    }

    public UploadStatusResponse getStatus(String batchId) {
        return buildStatusResponse(findBatch(batchId));
    }

    public UploadStatusListResponse getAllStatus() {
        List<UploadStatusResponse> items = batchRepository.findAll().stream()
                .map(this::buildStatusResponse)
                .collect(Collectors.toList());
        return UploadStatusListResponse.builder()
                .total(items.size())
                .items(items)
                .build();
    }

    public RecordListResponse getRecords(String batchId) {
        findBatch(batchId);
        List<RecordResultResponse> items = recordRepository.findAll(batchId).stream()
                .map(UploadService::toRecordResponse)
                .collect(Collectors.toList());
        return RecordListResponse.builder()
                .batchId(batchId)
                .total(items.size())
                .items(items)
                .build();
    }

    /**
     * Entfernt einen Upload samt Datensätzen. Cache-Einträge bleiben erhalten.
     */
    public void purge(String batchId) {
        UploadBatch batch = findBatch(batchId);
        if (batch.getStatus() == BatchStatus.PROCESSING || orchestrator.isRunning(batchId)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "batch is processing");
        }
        recordRepository.deleteAll(batchId);
        batchRepository.delete(batchId);
        log.info("Upload {} gelöscht", batchId);
    }

    /**
     * Baut die Status-Antwort aus den gespeicherten Datensätzen.
     */
    UploadStatusResponse buildStatusResponse(UploadBatch batch) {
        List<SkipTraceRecord> records = recordRepository.findAll(batch.getBatchId());

        int processed = (int) records.stream().filter(r -> r.getResult() != null).count();
        int failed = count(records, PipelineResult.FAILED_EXTERNAL);
        int succeeded = count(records, PipelineResult.ENRICHED_FRESH) + count(records, PipelineResult.ENRICHED_FROM_CACHE);
        int skipped = count(records, PipelineResult.SKIPPED_INVALID);
        // Wiederholungen derselben Zeile zählen nur einmal als Treffer
        int litigators = (int) records.stream()
                .filter(r -> r.getResult() == PipelineResult.MATCHED_LITIGATOR && !r.isDuplicate())
                .count();
        int duplicates = (int) records.stream().filter(SkipTraceRecord::isDuplicate).count();

        List<RowValidationError> rowErrors = records.stream()
                .map(SkipTraceRecord::getRowError)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        return UploadStatusResponse.builder()
                .batchId(batch.getBatchId())
                .ownerId(batch.getOwnerId())
                .filename(batch.getFilename())
                .status(batch.getStatus())
                .refreshPolicy(batch.getRefreshPolicy())
                .tags(batch.getTags())
                .running(orchestrator.isRunning(batch.getBatchId()))
                .runCount(batch.getRunCount())
                .errorMessage(batch.getErrorMessage())
                .processedCount(processed)
                .totalCount(batch.getTotalRows())
                .failedCount(failed)
                .succeeded(succeeded)
                .skipped(skipped)
                .litigators(litigators)
                .duplicates(duplicates)
                .hits(hitStatistics(records))
                .rowErrors(rowErrors)
                .createdAt(batch.getCreatedAt())
                .startedAt(batch.getStartedAt())
                .finishedAt(batch.getFinishedAt())
                .build();
    }

    private static HitStatistics hitStatistics(List<SkipTraceRecord> records) {
        HitStatistics hits = new HitStatistics();
        for (SkipTraceRecord r : records) {
            if (r.isDuplicate()) {
                continue;
            }
            EnrichmentSource source = r.getEnrichmentSource();
            if (source == EnrichmentSource.FRESH) {
                hits.setFreshFetches(hits.getFreshFetches() + 1);
            } else if (source == EnrichmentSource.CACHE) {
                hits.setCacheReuses(hits.getCacheReuses() + 1);
            }
            ContactMetadata contact = r.getContact();
            if (contact == null || !contact.hasData()) {
                continue;
            }
            hits.setTotalHits(hits.getTotalHits() + 1);
            if (source == EnrichmentSource.FRESH) {
                hits.setBillableHits(hits.getBillableHits() + 1);
            } else if (source == EnrichmentSource.CACHE) {
                hits.setExistingMatches(hits.getExistingMatches() + 1);
            }
            hits.setTotalPhones(hits.getTotalPhones() + contact.getPhones().size());
            hits.setTotalEmails(hits.getTotalEmails() + contact.getEmails().size());
            hits.setTotalAddresses(hits.getTotalAddresses() + contact.getAddressHistory().size());
        }
        return hits;
    }

    private List<ColumnMappingResponse> toColumnResponses(List<ColumnMapping> columns) {
        return columns.stream()
                .map(c -> ColumnMappingResponse.builder()
                        .columnIndex(c.getColumnIndex())
                        .header(c.getHeader())
                        .sampleValues(c.getSampleValues())
                        .field(c.getField())
                        .suggestion(c.getSuggestion())
                        .disabledFields(schemaMapper.disabledOptions(columns, c.getColumnIndex()))
                        .build())
                .collect(Collectors.toList());
    }

    private static RecordResultResponse toRecordResponse(SkipTraceRecord r) {
        return RecordResultResponse.builder()
                .recordId(r.getRecordId())
                .rowNumber(r.getRowNumber())
                .duplicateOfRow(r.getDuplicateOfRow())
                .result(r.getResult())
                .completedStages(r.getCompletedStages().isEmpty()
                        ? EnumSet.noneOf(RecordStage.class)
                        : EnumSet.copyOf(r.getCompletedStages()))
                .enrichmentSource(r.getEnrichmentSource())
                .record(r.getCanonical())
                .contact(r.getContact())
                .matchedLitigatorId(r.getMatchedLitigatorId())
                .matchedLitigatorType(r.getMatchedLitigatorType())
                .tags(r.getTags())
                .attempts(r.getAttempts())
                .errorMessage(r.getErrorMessage())
                .rowError(r.getRowError())
                .build();
    }

    private void runInBackground(String batchId) {
        try {
            orchestrator.processQueued(batchId);
        } catch (RuntimeException e) {
            log.error("Hintergrundlauf für Upload {} fehlgeschlagen", batchId, e);
        }
    }

    private UploadBatch findBatch(String batchId) {
        return batchRepository.find(batchId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "batchId not found"));
    }

    private static int count(List<SkipTraceRecord> records, PipelineResult result) {
        return (int) records.stream().filter(r -> r.getResult() == result).count();
    }

    private static List<List<String>> copyRows(List<List<String>> rows) {
        return rows.stream()
                .map(r -> r == null ? new ArrayList<String>() : new ArrayList<>(r))
                .collect(Collectors.toList());
    }
}
