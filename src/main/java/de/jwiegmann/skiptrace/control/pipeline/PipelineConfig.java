package de.jwiegmann.skiptrace.control.pipeline;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-Pools der Verarbeitung.
 * <ul>
 *     <li>{@code pipelineWorkerPool}: begrenzte Zahl paralleler Datensätze</li>
 *     <li>{@code enrichmentCallPool}: Anbieter-Aufrufe, damit der Worker mit Timeout warten kann</li>
 *     <li>{@code batchRunnerPool}: Läufe, die nach der Mapping-Bestätigung im Hintergrund starten</li>
 * </ul>
 */
@Configuration
public class PipelineConfig {

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor pipelineWorkerPool(@Value("${upload.processing.worker-threads:8}") int workerThreads) {
        return new MdcAwareExecutor(Executors.newFixedThreadPool(Math.max(1, workerThreads), named("skiptrace-worker-")));
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor enrichmentCallPool() {
        return new MdcAwareExecutor(Executors.newCachedThreadPool(named("skiptrace-enrichment-")));
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor batchRunnerPool() {
        return new MdcAwareExecutor(Executors.newCachedThreadPool(named("skiptrace-batch-")));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
