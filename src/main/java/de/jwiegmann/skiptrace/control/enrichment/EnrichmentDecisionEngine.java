package de.jwiegmann.skiptrace.control.enrichment;

import de.jwiegmann.skiptrace.control.exception.ExternalServiceException;
import de.jwiegmann.skiptrace.control.normalize.Fingerprints;
import de.jwiegmann.skiptrace.entity.CanonicalRecord;
import de.jwiegmann.skiptrace.entity.EnrichmentEntry;
import de.jwiegmann.skiptrace.entity.EnrichmentSource;
import de.jwiegmann.skiptrace.entity.RefreshPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Entscheidet pro Datensatz zwischen Cache-Treffer und kostenpflichtigem Fresh Fetch.
 *
 * <p>Die Entscheidung läuft unter der Sperre des Adress-Fingerprints. Damit ist pro Fingerprint
 * höchstens ein Fetch gleichzeitig unterwegs, und wartende Datensätze sehen dessen Ergebnis.
 */
@Slf4j
@Service
public class EnrichmentDecisionEngine {

    private final EnrichmentCache cache;
    private final FingerprintLocks locks;
    private final RetryingEnrichmentCaller caller;
    private final Duration maxAge;

    public EnrichmentDecisionEngine(EnrichmentCache cache,
                                    FingerprintLocks locks,
                                    RetryingEnrichmentCaller caller,
                                    @Value("${enrichment.cache.max-age:}") String maxAge) {
        this.cache = cache;
        this.locks = locks;
        this.caller = caller;
        this.maxAge = maxAge == null || maxAge.isBlank() ? null : Duration.parse(maxAge);
    }

    /**
     * @param onAttempt wird vor jedem Anbieter-Aufruf ausgeführt
     * @throws ExternalServiceException wenn der Anbieter auch nach allen Wiederholungen nicht antwortet
     */
    public EnrichmentDecision decide(CanonicalRecord record, EnrichmentRun run, Runnable onAttempt) {
        Optional<String> fingerprint = Fingerprints.propertyAddress(record);
        if (fingerprint.isEmpty()) {
            return new EnrichmentDecision(null, EnrichmentSource.NO_ADDRESS, null);
        }
        String fp = fingerprint.get();
        return locks.withLock(fp, () -> decideLocked(fp, record, run, onAttempt));
    }

    private EnrichmentDecision decideLocked(String fp, CanonicalRecord record, EnrichmentRun run, Runnable onAttempt) {
        EnrichmentResponse earlier = run.getFetched().get(fp);
        if (earlier != null) {
            // in diesem Lauf bereits abgefragt
            return earlier.isFound()
                    ? new EnrichmentDecision(fp, EnrichmentSource.CACHE, earlier.getContact())
                    : new EnrichmentDecision(fp, EnrichmentSource.NOT_FOUND, null);
        }

        if (run.getPolicy() == RefreshPolicy.PREFER_CACHE) {
            Optional<EnrichmentEntry> cached = cache.get(fp).filter(this::isFresh);
            if (cached.isPresent()) {
                log.debug("Cache-Treffer für {}", fp);
                return new EnrichmentDecision(fp, EnrichmentSource.CACHE, cached.get().getContact());
            }
        }

        EnrichmentResponse response = caller.lookup(record.getPropertyAddress(), onAttempt);
        run.getFetched().put(fp, response);
        if (!response.isFound()) {
            log.debug("Keine Daten beim Anbieter für {}", fp);
            return new EnrichmentDecision(fp, EnrichmentSource.NOT_FOUND, null);
        }

        cache.put(EnrichmentEntry.builder()
                .fingerprint(fp)
                .contact(response.getContact())
                .fetchedAt(Instant.now())
                .sourceBatchId(run.getBatchId())
                .build());
        log.info("Fresh Fetch für {} (Policy {})", fp, run.getPolicy());
        return new EnrichmentDecision(fp, EnrichmentSource.FRESH, response.getContact());
    }

    private boolean isFresh(EnrichmentEntry entry) {
        return maxAge == null || entry.getFetchedAt().plus(maxAge).isAfter(Instant.now());
    }
}
