package de.jwiegmann.skiptrace.control.enrichment;

import de.jwiegmann.skiptrace.control.exception.ExternalServiceException;
import de.jwiegmann.skiptrace.control.exception.ExternalServiceException.Reason;
import de.jwiegmann.skiptrace.entity.PostalAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ruft den Anbieter mit Timeout auf und wiederholt vorübergehende Fehler mit exponentiellem Backoff.
 */
@Slf4j
@Component
public class RetryingEnrichmentCaller {

    private final EnrichmentClient client;
    private final Executor callPool;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration backoff;

    public RetryingEnrichmentCaller(EnrichmentClient client,
                                    @Qualifier("enrichmentCallPool") Executor callPool,
                                    @Value("${enrichment.client.timeout:PT10S}") Duration timeout,
                                    @Value("${enrichment.retry.max-attempts:3}") int maxAttempts,
                                    @Value("${enrichment.retry.backoff:PT0.5S}") Duration backoff) {
        this.client = client;
        this.callPool = callPool;
        this.timeout = timeout;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = backoff;
    }

    /**
     * @param onAttempt wird vor jedem Versuch aufgerufen (Zähler am Datensatz)
     * @throws ExternalServiceException wenn alle Versuche fehlgeschlagen sind
     */
    public EnrichmentResponse lookup(PostalAddress address, Runnable onAttempt) {
        ExternalServiceException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            onAttempt.run();
            try {
                return callOnce(address);
            } catch (ExternalServiceException e) {
                last = e;
                log.info("Anbieter-Aufruf fehlgeschlagen (Versuch {}/{}): {} {}",
                        attempt, maxAttempts, e.getReason(), e.getMessage());
                if (attempt < maxAttempts) {
                    sleep(backoff.multipliedBy(1L << (attempt - 1)));
                }
            }
        }
        log.warn("Anbieter nach {} Versuchen nicht verfügbar: {}", maxAttempts, last.getMessage());
        throw last;
    }

    /**
     * Ein Versuch mit Timeout. Nach einem Timeout wird der Aufruf unterbrochen und sein Ende abgewartet,
     * damit pro Fingerprint nie zwei Anbieter-Aufrufe gleichzeitig laufen.
     */
    private EnrichmentResponse callOnce(PostalAddress address) {
        FutureTask<EnrichmentResponse> task = new FutureTask<>(() -> client.lookup(address));
        CountDownLatch finished = new CountDownLatch(1);
        callPool.execute(() -> {
            try {
                task.run();
            } finally {
                finished.countDown();
            }
        });
        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(task, finished);
            throw new ExternalServiceException(Reason.TIMEOUT, "no answer within " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExternalServiceException) {
                throw (ExternalServiceException) cause;
            }
            throw new ExternalServiceException(Reason.SERVICE_ERROR, "enrichment call failed: " + cause, cause);
        } catch (InterruptedException e) {
            abandon(task, finished);
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(Reason.SERVICE_ERROR, "interrupted while waiting for enrichment", e);
        }
    }

    private static void abandon(FutureTask<EnrichmentResponse> task, CountDownLatch finished) {
        task.cancel(true);
        boolean interrupted = false;
        while (true) {
            try {
                finished.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(Reason.SERVICE_ERROR, "interrupted during retry backoff", e);
        }
    }
}
