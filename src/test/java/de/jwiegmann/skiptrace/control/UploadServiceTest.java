package de.jwiegmann.skiptrace.control;

import de.jwiegmann.skiptrace.boundary.dto.init.UploadInitRequest;
import de.jwiegmann.skiptrace.boundary.dto.mapping.ColumnAssignment;
import de.jwiegmann.skiptrace.boundary.dto.mapping.MappingConfirmRequest;
import de.jwiegmann.skiptrace.boundary.dto.record.RecordResultResponse;
import de.jwiegmann.skiptrace.boundary.dto.status.UploadStatusResponse;
import de.jwiegmann.skiptrace.control.enrichment.CountingEnrichmentClient;
import de.jwiegmann.skiptrace.control.enrichment.EnrichmentDecisionEngine;
import de.jwiegmann.skiptrace.control.enrichment.FingerprintLocks;
import de.jwiegmann.skiptrace.control.enrichment.InMemoryEnrichmentCache;
import de.jwiegmann.skiptrace.control.enrichment.RetryingEnrichmentCaller;
import de.jwiegmann.skiptrace.control.litigator.InMemoryLitigatorBlocklist;
import de.jwiegmann.skiptrace.control.litigator.LitigatorMatcher;
import de.jwiegmann.skiptrace.control.mapping.FieldAliasRegistry;
import de.jwiegmann.skiptrace.control.mapping.SchemaMapper;
import de.jwiegmann.skiptrace.control.normalize.RecordNormalizer;
import de.jwiegmann.skiptrace.control.pipeline.MdcAwareExecutor;
import de.jwiegmann.skiptrace.control.pipeline.PipelineOrchestrator;
import de.jwiegmann.skiptrace.control.pipeline.RecordPipeline;
import de.jwiegmann.skiptrace.control.repository.InMemorySkipTraceRecordRepository;
import de.jwiegmann.skiptrace.control.repository.InMemoryUploadBatchRepository;
import de.jwiegmann.skiptrace.control.tag.InMemoryTagSink;
import de.jwiegmann.skiptrace.control.tag.TagApplier;
import de.jwiegmann.skiptrace.entity.BatchStatus;
import de.jwiegmann.skiptrace.entity.CanonicalField;
import de.jwiegmann.skiptrace.entity.LitigatorRecord;
import de.jwiegmann.skiptrace.entity.LitigatorType;
import de.jwiegmann.skiptrace.entity.PipelineResult;
import de.jwiegmann.skiptrace.entity.PostalAddress;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class UploadServiceTest {

    private static final List<String> HEADER =
            List.of("Full Name", "Property Address", "Property City", "Property State", "Property Zip");

    private final ExecutorService callPool = Executors.newCachedThreadPool();
    private final ExecutorService workerPool = Executors.newSingleThreadExecutor();
    // Auto-Start-Läufe werden nur eingereiht und im Test von Hand ausgeführt
    private final List<Runnable> queued = new ArrayList<>();

    private final CountingEnrichmentClient client = new CountingEnrichmentClient();
    private final InMemoryUploadBatchRepository batchRepository = new InMemoryUploadBatchRepository();
    private final InMemorySkipTraceRecordRepository recordRepository = new InMemorySkipTraceRecordRepository();
    private final InMemoryLitigatorBlocklist blocklist = new InMemoryLitigatorBlocklist();

    private final PipelineOrchestrator orchestrator = new PipelineOrchestrator(
            batchRepository,
            recordRepository,
            new RecordNormalizer(255),
            new RecordPipeline(
                    new EnrichmentDecisionEngine(new InMemoryEnrichmentCache(), new FingerprintLocks(),
                            new RetryingEnrichmentCaller(client, callPool, Duration.ofSeconds(2), 2, Duration.ZERO), ""),
                    new LitigatorMatcher(blocklist),
                    new TagApplier(new InMemoryTagSink())),
            new MdcAwareExecutor(workerPool));

    private final UploadService service = new UploadService(
            batchRepository,
            recordRepository,
            new SchemaMapper(new FieldAliasRegistry(new MockEnvironment()), 7, 3),
            orchestrator,
            queued::add,
            10_000,
            true);

    @AfterEach
    void tearDown() {
        callPool.shutdownNow();
        workerPool.shutdownNow();
    }

    private String createAndConfirm(List<List<String>> dataRows) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(HEADER);
        rows.addAll(dataRows);
        String batchId = service.createBatch(UploadInitRequest.builder()
                .ownerId("owner-1")
                .filename("leads.csv")
                .rows(rows)
                .hasHeaderRow(true)
                .build()).getBatchId();

        service.confirmMapping(batchId, MappingConfirmRequest.builder()
                .assignments(List.of(
                        new ColumnAssignment(0, CanonicalField.FULL_NAME),
                        new ColumnAssignment(1, CanonicalField.PROPERTY_STREET),
                        new ColumnAssignment(2, CanonicalField.PROPERTY_CITY),
                        new ColumnAssignment(3, CanonicalField.PROPERTY_STATE),
                        new ColumnAssignment(4, CanonicalField.PROPERTY_ZIP)))
                .tags(List.of("campaign-1"))
                .build());
        return batchId;
    }

    private static List<String> row(String name, String street) {
        return List.of(name, street, "Springfield", "IL", "62701");
    }

    @Test
    void cancelBeforeQueuedRunStarts_schedulesNoRecordWork() {
        String batchId = createAndConfirm(List.of(
                row("a one", "1 Pine St"),
                row("b two", "2 Pine St"),
                row("c three", "3 Pine St")));
        assertThat(queued).hasSize(1);

        UploadStatusResponse cancelled = service.cancel(batchId);
        assertThat(cancelled.getStatus()).isEqualTo(BatchStatus.FAILED_PARTIAL);

        // der eingereihte Auto-Start läuft erst nach dem Abbruch an
        queued.forEach(Runnable::run);

        UploadStatusResponse status = service.getStatus(batchId);
        assertThat(status.getStatus()).isEqualTo(BatchStatus.FAILED_PARTIAL);
        assertThat(status.getErrorMessage()).isEqualTo("processing cancelled");
        assertThat(status.getProcessedCount()).isZero();
        assertThat(client.calls()).isZero();

        // explizites Fortsetzen hebt den Abbruch auf
        UploadStatusResponse resumed = service.process(batchId);
        assertThat(resumed.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(resumed.getProcessedCount()).isEqualTo(3);
        assertThat(client.calls()).isEqualTo(3);
    }

    @Test
    void repeatedRows_areFlaggedAsDuplicates_andCountedOnce() {
        blocklist.register(LitigatorRecord.builder()
                .litigatorId("L-1")
                .firstName("Larry")
                .lastName("Litigator")
                .address(new PostalAddress("3 OAK AVE", "SPRINGFIELD", "IL", "62701"))
                .type(LitigatorType.LITIGATOR)
                .build());

        String batchId = createAndConfirm(List.of(
                row("jane doe", "1 Main St"),
                row("JANE DOE", "1 main st."),
                row("larry litigator", "3 Oak Ave"),
                row("Larry Litigator", "3 OAK AVE"),
                row("john roe", "1 Main St")));
        queued.forEach(Runnable::run);

        UploadStatusResponse status = service.getStatus(batchId);
        assertThat(status.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(status.getDuplicates()).isEqualTo(2);
        assertThat(status.getLitigators()).isEqualTo(1);
        // Jane Doe, Larry Litigator und John Roe; die Wiederholungen zählen nicht
        assertThat(status.getHits().getTotalHits()).isEqualTo(3);
        assertThat(status.getHits().getBillableHits()).isEqualTo(2);
        assertThat(status.getHits().getExistingMatches()).isEqualTo(1);
        assertThat(client.callsFor("1 MAIN ST")).isEqualTo(1);

        List<RecordResultResponse> records = service.getRecords(batchId).getItems();
        assertThat(records.get(1).getDuplicateOfRow()).isEqualTo(1);
        assertThat(records.get(3).getDuplicateOfRow()).isEqualTo(3);
        assertThat(records.get(4).getDuplicateOfRow()).isNull();
        assertThat(records.get(3).getResult()).isEqualTo(PipelineResult.MATCHED_LITIGATOR);
    }
}
