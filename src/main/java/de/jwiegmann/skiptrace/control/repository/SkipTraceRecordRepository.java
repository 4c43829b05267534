package de.jwiegmann.skiptrace.control.repository;

import de.jwiegmann.skiptrace.entity.SkipTraceRecord;

import java.util.List;
import java.util.Optional;

public interface SkipTraceRecordRepository {

    /**
     * Idempotentes Speichern: true, wenn die Zeile neu war; false, wenn sie schon existierte
     * (z.B. beim Resume eines unterbrochenen Laufs).
     */
    boolean saveIfAbsent(SkipTraceRecord record);

    Optional<SkipTraceRecord> find(String batchId, int rowNumber);

    /** Sortiert nach Zeilennummer. */
    List<SkipTraceRecord> findAll(String batchId);

    List<SkipTraceRecord> findPending(String batchId);

    void deleteAll(String batchId);
}
