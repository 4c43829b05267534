package de.jwiegmann.skiptrace.control.pipeline;

import de.jwiegmann.skiptrace.control.enrichment.EnrichmentRun;
import de.jwiegmann.skiptrace.control.normalize.Fingerprints;
import de.jwiegmann.skiptrace.control.normalize.NormalizedRow;
import de.jwiegmann.skiptrace.control.normalize.RecordNormalizer;
import de.jwiegmann.skiptrace.control.repository.SkipTraceRecordRepository;
import de.jwiegmann.skiptrace.control.repository.UploadBatchRepository;
import de.jwiegmann.skiptrace.entity.BatchStatus;
import de.jwiegmann.skiptrace.entity.PipelineResult;
import de.jwiegmann.skiptrace.entity.RecordStage;
import de.jwiegmann.skiptrace.entity.SkipTraceRecord;
import de.jwiegmann.skiptrace.entity.UploadBatch;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Zustandsmaschine pro Upload: mapping -> processing -> completed | failed_partial.
 *
 * <p>{@link #process(String)} darf beliebig oft aufgerufen werden. Ein Lauf verarbeitet nur Datensätze
 * ohne Ergebnis oder mit {@code failed_external}; alle anderen behalten ihr Ergebnis.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    static final String MDC_BATCH_ID = "batchId";

    private final UploadBatchRepository batchRepository;
    private final SkipTraceRecordRepository recordRepository;
    private final RecordNormalizer normalizer;
    private final RecordPipeline recordPipeline;
    private final Executor workers;

    private final Set<String> activeRuns = ConcurrentHashMap.newKeySet();

    public PipelineOrchestrator(UploadBatchRepository batchRepository,
                                SkipTraceRecordRepository recordRepository,
                                RecordNormalizer normalizer,
                                RecordPipeline recordPipeline,
                                @Qualifier("pipelineWorkerPool") Executor workers) {
        this.batchRepository = batchRepository;
        this.recordRepository = recordRepository;
        this.normalizer = normalizer;
        this.recordPipeline = recordPipeline;
        this.workers = workers;
    }

    /**
     * Startet oder setzt die Verarbeitung eines Uploads fort und wartet auf das Ende des Laufs.
     * Ein expliziter Aufruf hebt einen vorherigen Abbruch auf.
     *
     * @param batchId ID des Uploads
     * @return Upload nach dem Lauf
     * @throws ResponseStatusException 404 wenn unbekannt, 409 solange das Mapping nicht bestätigt ist
     */
    public UploadBatch process(String batchId) {
        return start(batchId, true);
    }

    /**
     * Lauf aus der Warteschlange (Auto-Start nach der Mapping-Bestätigung).
     * Wurde der Upload vorher abgebrochen, startet nichts.
     */
    public UploadBatch processQueued(String batchId) {
        return start(batchId, false);
    }

    /**
     * Kooperativer Abbruch: laufende Datensätze werden fertig, neue werden nicht mehr gestartet.
     * Läuft gerade nichts, geht der Upload sofort auf failed_partial.
     */
    public UploadBatch cancel(String batchId) {
        UploadBatch batch = batchRepository.find(batchId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "batchId not found"));
        synchronized (batch) {
            if (batch.getStatus() != BatchStatus.PROCESSING) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, "batch is not processing");
            }
            batch.setCancelRequested(true);
            if (!activeRuns.contains(batchId)) {
                markCancelled(batch);
            }
        }
        log.info("Abbruch für Upload {} angefordert", batchId);
        return batch;
    }

    public boolean isRunning(String batchId) {
        return activeRuns.contains(batchId);
    }

    private UploadBatch start(String batchId, boolean resume) {
        UploadBatch batch = batchRepository.find(batchId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "batchId not found"));

        if (batch.getStatus() == BatchStatus.MAPPING) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "column mapping not confirmed yet");
        }
        if (batch.getStatus() == BatchStatus.COMPLETED) {
            return batch;
        }
        if (!activeRuns.add(batchId)) {
            log.info("Upload {} wird bereits verarbeitet, Aufruf ignoriert", batchId);
            return batch;
        }

        MDC.put(MDC_BATCH_ID, batchId);
        try {
            // 1. Status setzen; gegen cancel() synchronisiert, damit kein Abbruch verloren geht
            synchronized (batch) {
                if (resume) {
                    batch.setCancelRequested(false);
                } else if (batch.isCancelRequested()) {
                    markCancelled(batch);
                    log.info("Upload {} vor dem Start abgebrochen, Lauf entfällt", batchId);
                    return batch;
                }
                batch.setStatus(BatchStatus.PROCESSING);
                batch.setRunCount(batch.getRunCount() + 1);
                batch.setStartedAt(LocalDateTime.now());
                batch.setFinishedAt(null);
                batch.setErrorMessage(null);
            }
            log.info("Lauf {} für Upload {} gestartet (Policy {})", batch.getRunCount(), batchId, batch.getRefreshPolicy());
            run(batch);
        } finally {
            activeRuns.remove(batchId);
            MDC.remove(MDC_BATCH_ID);
        }
        return batch;
    }

    private static void markCancelled(UploadBatch batch) {
        batch.setStatus(BatchStatus.FAILED_PARTIAL);
        batch.setErrorMessage("processing cancelled");
        batch.setFinishedAt(LocalDateTime.now());
    }

    private void run(UploadBatch batch) {
        String batchId = batch.getBatchId();

        // 2. Normalisieren (idempotent pro Zeilennummer), Wiederholungen verweisen auf die erste Zeile
        Map<String, Integer> firstRowByKey = new HashMap<>();
        normalizer.normalize(batch.getRawRows(), batch.isHasHeaderRow(), batch.getColumnMappings())
                .map(row -> toRecord(batchId, row, firstRowByKey))
                .forEach(recordRepository::saveIfAbsent);

        // 3. Offene Datensätze parallel verarbeiten
        List<SkipTraceRecord> pending = recordRepository.findPending(batchId);
        EnrichmentRun enrichmentRun = new EnrichmentRun(batchId, batch.getRefreshPolicy());
        AtomicBoolean halted = new AtomicBoolean();

        CompletableFuture<?>[] tasks = pending.stream()
                .map(record -> CompletableFuture.runAsync(
                        () -> processRecord(batch, record, enrichmentRun, halted), workers))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(tasks).join();

        // 4. Abschluss
        List<SkipTraceRecord> all = recordRepository.findAll(batchId);
        boolean complete = all.stream().allMatch(r -> r.getResult() != null && r.getResult().isFinal());
        batch.setStatus(complete ? BatchStatus.COMPLETED : BatchStatus.FAILED_PARTIAL);
        batch.setFinishedAt(LocalDateTime.now());
        if (!complete) {
            batch.setErrorMessage(batch.isCancelRequested() ? "processing cancelled"
                    : halted.get() ? "enrichment provider unavailable" : "processing incomplete");
        }

        long open = all.stream().filter(SkipTraceRecord::isPending).count();
        if (complete) {
            log.info("Upload {} abgeschlossen: {} Datensätze", batchId, all.size());
        } else {
            log.warn("Upload {} teilweise verarbeitet: {} von {} offen ({})", batchId, open, all.size(), batch.getErrorMessage());
        }
    }

    private void processRecord(UploadBatch batch, SkipTraceRecord record, EnrichmentRun run, AtomicBoolean halted) {
        if (batch.isCancelRequested() || halted.get()) {
            return;
        }
        try {
            PipelineResult result = recordPipeline.process(record, batch, run);
            if (result == PipelineResult.FAILED_EXTERNAL && halted.compareAndSet(false, true)) {
                log.warn("Anbieter ausgefallen bei Zeile {}, keine weiteren Datensätze in diesem Lauf", record.getRowNumber());
            }
        } catch (RuntimeException e) {
            // Datensatz bleibt offen und wird beim nächsten Lauf erneut versucht
            log.error("Unerwarteter Fehler in Zeile {}", record.getRowNumber(), e);
            record.setErrorMessage(e.getMessage());
        }
    }

    private static SkipTraceRecord toRecord(String batchId, NormalizedRow row, Map<String, Integer> firstRowByKey) {
        SkipTraceRecord record = SkipTraceRecord.builder()
                .recordId(SkipTraceRecord.recordId(batchId, row.getRowNumber()))
                .batchId(batchId)
                .rowNumber(row.getRowNumber())
                .canonical(row.getRecord())
                .rowError(row.getError())
                .completedStages(EnumSet.noneOf(RecordStage.class))
                .updatedAt(LocalDateTime.now())
                .build();
        record.complete(RecordStage.NORMALIZED);
        if (!row.isValid()) {
            record.setResult(PipelineResult.SKIPPED_INVALID);
            record.setErrorMessage(row.getError().getMessage());
            return record;
        }
        Fingerprints.duplicateKey(row.getRecord()).ifPresent(key -> {
            Integer first = firstRowByKey.putIfAbsent(key, row.getRowNumber());
            if (first != null) {
                record.setDuplicateOfRow(first);
            }
        });
        return record;
    }
}
