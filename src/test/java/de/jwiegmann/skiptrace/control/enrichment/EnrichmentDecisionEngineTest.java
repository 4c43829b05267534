package de.jwiegmann.skiptrace.control.enrichment;

import de.jwiegmann.skiptrace.control.exception.ExternalServiceException;
import de.jwiegmann.skiptrace.control.normalize.Fingerprints;
import de.jwiegmann.skiptrace.entity.CanonicalRecord;
import de.jwiegmann.skiptrace.entity.ContactMetadata;
import de.jwiegmann.skiptrace.entity.EnrichmentEntry;
import de.jwiegmann.skiptrace.entity.EnrichmentSource;
import de.jwiegmann.skiptrace.entity.PostalAddress;
import de.jwiegmann.skiptrace.entity.RefreshPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class EnrichmentDecisionEngineTest {

    private final ExecutorService callPool = Executors.newCachedThreadPool();
    private final ExecutorService workers = Executors.newFixedThreadPool(8);
    private final CountingEnrichmentClient client = new CountingEnrichmentClient();
    private final InMemoryEnrichmentCache cache = new InMemoryEnrichmentCache();
    private final FingerprintLocks locks = new FingerprintLocks();

    private EnrichmentDecisionEngine engine(String maxAge) {
        return engine(maxAge, Duration.ofSeconds(5));
    }

    private EnrichmentDecisionEngine engine(String maxAge, Duration timeout) {
        RetryingEnrichmentCaller caller = new RetryingEnrichmentCaller(client, callPool,
                timeout, 3, Duration.ZERO);
        return new EnrichmentDecisionEngine(cache, locks, caller, maxAge);
    }

    private <T> List<T> startTogether(List<Supplier<T>> tasks) {
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<T>> futures = new ArrayList<>();
        for (Supplier<T> task : tasks) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return task.get();
            }, workers));
        }
        start.countDown();
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    @AfterEach
    void tearDown() {
        callPool.shutdownNow();
        workers.shutdownNow();
    }

    private static CanonicalRecord record(int row, String street) {
        return CanonicalRecord.builder()
                .rowNumber(row)
                .firstName("Jane")
                .lastName("Doe")
                .propertyAddress(new PostalAddress(street, "SPRINGFIELD", "IL", "62701"))
                .build();
    }

    private void warm(String street) {
        String fp = Fingerprints.propertyAddress(record(0, street)).orElseThrow();
        cache.put(EnrichmentEntry.builder()
                .fingerprint(fp)
                .contact(ContactMetadata.builder().ownerNames(List.of("Cached Owner")).build())
                .fetchedAt(Instant.now().minus(Duration.ofDays(400)))
                .sourceBatchId("older-batch")
                .build());
    }

    private static Runnable noop() {
        return () -> { };
    }

    @Test
    void preferCache_withWarmCache_makesNoExternalCalls() {
        EnrichmentDecisionEngine engine = engine("");
        warm("1 MAIN ST");
        warm("2 MAIN ST");
        EnrichmentRun run = new EnrichmentRun("b1", RefreshPolicy.PREFER_CACHE);

        List<EnrichmentDecision> decisions = List.of(
                engine.decide(record(1, "1 MAIN ST"), run, noop()),
                engine.decide(record(2, "2 MAIN ST"), run, noop()),
                engine.decide(record(3, "1 main st."), run, noop()));

        assertThat(client.calls()).isZero();
        assertThat(decisions).allMatch(d -> d.getSource() == EnrichmentSource.CACHE);
        assertThat(decisions.get(0).getContact().getOwnerNames()).containsExactly("Cached Owner");
    }

    @Test
    void forceRefresh_fetchesEachFingerprintExactlyOncePerRun_evenWithWarmCache() {
        EnrichmentDecisionEngine engine = engine("");
        warm("1 MAIN ST");
        warm("2 MAIN ST");
        EnrichmentRun run = new EnrichmentRun("b1", RefreshPolicy.FORCE_REFRESH);

        List<EnrichmentDecision> decisions = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            decisions.add(engine.decide(record(i + 1, (i % 3 + 1) + " MAIN ST"), run, noop()));
        }

        assertThat(client.calls()).isEqualTo(3);
        assertThat(decisions.stream().filter(d -> d.getSource() == EnrichmentSource.FRESH)).hasSize(3);
        // Cache-Eintrag wurde durch den neuen Fetch überschrieben
        String fp = Fingerprints.propertyAddress(record(0, "1 MAIN ST")).orElseThrow();
        assertThat(cache.get(fp).orElseThrow().getSourceBatchId()).isEqualTo("b1");
        assertThat(cache.get(fp).orElseThrow().getContact().getOwnerNames()).containsExactly("Owner of 1 MAIN ST");

        // neuer Lauf -> wieder genau ein Fetch pro Fingerprint
        EnrichmentRun second = new EnrichmentRun("b2", RefreshPolicy.FORCE_REFRESH);
        engine.decide(record(1, "1 MAIN ST"), second, noop());
        assertThat(client.callsFor("1 MAIN ST")).isEqualTo(2);
    }

    @Test
    void concurrentRecordsSharingAnAddress_payForExactlyOneFetch() throws Exception {
        EnrichmentDecisionEngine engine = engine("");
        client.setDelayMillis(50);
        EnrichmentRun run = new EnrichmentRun("b1", RefreshPolicy.PREFER_CACHE);
        CountDownLatch start = new CountDownLatch(1);

        List<CompletableFuture<EnrichmentDecision>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            final int row = i + 1;
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return engine.decide(record(row, "9 ELM ST"), run, noop());
            }, workers));
        }
        start.countDown();
        List<EnrichmentDecision> decisions = futures.stream().map(CompletableFuture::join).collect(Collectors.toList());

        assertThat(client.calls()).isEqualTo(1);
        assertThat(decisions.stream().filter(d -> d.getSource() == EnrichmentSource.FRESH)).hasSize(1);
        assertThat(decisions.stream().filter(d -> d.getSource() == EnrichmentSource.CACHE)).hasSize(19);
        assertThat(decisions).extracting(EnrichmentDecision::getContact).containsOnly(decisions.get(0).getContact());
        assertThat(locks.activeCount()).isZero();
    }

    @Test
    void concurrentBatchesSharingAnAddress_payForExactlyOneFetch() {
        EnrichmentDecisionEngine engine = engine("");
        client.setDelayMillis(50);
        EnrichmentRun first = new EnrichmentRun("b1", RefreshPolicy.PREFER_CACHE);
        EnrichmentRun second = new EnrichmentRun("b2", RefreshPolicy.PREFER_CACHE);

        List<Supplier<EnrichmentDecision>> tasks = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            final int row = i + 1;
            tasks.add(() -> engine.decide(record(row, "5 ASH CT"), first, noop()));
            tasks.add(() -> engine.decide(record(row, "5 ASH CT"), second, noop()));
        }
        List<EnrichmentDecision> decisions = startTogether(tasks);

        assertThat(client.calls()).isEqualTo(1);
        assertThat(decisions.stream().filter(d -> d.getSource() == EnrichmentSource.FRESH)).hasSize(1);
        assertThat(decisions.stream().filter(d -> d.getSource() == EnrichmentSource.CACHE)).hasSize(19);
        assertThat(locks.activeCount()).isZero();
    }

    @Test
    void timedOutFetches_neverOverlapForOneFingerprint() {
        EnrichmentDecisionEngine engine = engine("", Duration.ofMillis(30));
        client.setDelayMillis(120);
        client.setIgnoreInterrupts(true);
        EnrichmentRun first = new EnrichmentRun("b1", RefreshPolicy.PREFER_CACHE);
        EnrichmentRun second = new EnrichmentRun("b2", RefreshPolicy.PREFER_CACHE);

        List<Supplier<String>> tasks = List.of(
                () -> outcome(engine, record(1, "8 BAY RD"), first),
                () -> outcome(engine, record(2, "8 BAY RD"), second));
        List<String> outcomes = startTogether(tasks);

        assertThat(outcomes).containsOnly("TIMEOUT");
        assertThat(client.calls()).isEqualTo(6);
        assertThat(client.maxInFlight()).isEqualTo(1);
        assertThat(locks.activeCount()).isZero();
    }

    private static String outcome(EnrichmentDecisionEngine engine, CanonicalRecord record, EnrichmentRun run) {
        try {
            return engine.decide(record, run, noop()).getSource().name();
        } catch (ExternalServiceException e) {
            return e.getReason().name();
        }
    }

    @Test
    void hundredRecordsOnFortyProperties_coldCache_fortyFetchesSixtyReuses() {
        EnrichmentDecisionEngine engine = engine("");
        EnrichmentRun run = new EnrichmentRun("b1", RefreshPolicy.PREFER_CACHE);

        List<CompletableFuture<EnrichmentDecision>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            CanonicalRecord r = record(i + 1, (i % 40 + 1) + " OAK AVE");
            futures.add(CompletableFuture.supplyAsync(() -> engine.decide(r, run, noop()), workers));
        }
        Map<EnrichmentSource, Long> bySource = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.groupingBy(EnrichmentDecision::getSource, Collectors.counting()));

        assertThat(client.calls()).isEqualTo(40);
        assertThat(bySource).containsEntry(EnrichmentSource.FRESH, 40L).containsEntry(EnrichmentSource.CACHE, 60L);
        assertThat(cache.size()).isEqualTo(40);
    }

    @Test
    void notFound_isNotCached_andNotFetchedTwiceInOneRun() {
        EnrichmentDecisionEngine engine = engine("");
        client.notFound("7 VOID RD");
        EnrichmentRun run = new EnrichmentRun("b1", RefreshPolicy.PREFER_CACHE);

        EnrichmentDecision first = engine.decide(record(1, "7 VOID RD"), run, noop());
        EnrichmentDecision second = engine.decide(record(2, "7 VOID RD"), run, noop());

        assertThat(first.getSource()).isEqualTo(EnrichmentSource.NOT_FOUND);
        assertThat(second.getSource()).isEqualTo(EnrichmentSource.NOT_FOUND);
        assertThat(client.calls()).isEqualTo(1);
        assertThat(cache.size()).isZero();
    }

    @Test
    void recordWithoutUsableAddress_isNotLookedUp() {
        EnrichmentDecisionEngine engine = engine("");
        CanonicalRecord noAddress = CanonicalRecord.builder().rowNumber(1).lastName("Doe").build();

        EnrichmentDecision decision = engine.decide(noAddress, new EnrichmentRun("b1", RefreshPolicy.PREFER_CACHE), noop());

        assertThat(decision.getSource()).isEqualTo(EnrichmentSource.NO_ADDRESS);
        assertThat(client.calls()).isZero();
    }

    @Test
    void maxAge_treatsOlderEntriesAsMissing() {
        EnrichmentDecisionEngine engine = engine("P30D");
        warm("1 MAIN ST");

        EnrichmentDecision decision = engine.decide(record(1, "1 MAIN ST"),
                new EnrichmentRun("b1", RefreshPolicy.PREFER_CACHE), noop());

        assertThat(decision.getSource()).isEqualTo(EnrichmentSource.FRESH);
        assertThat(client.calls()).isEqualTo(1);
    }
}
