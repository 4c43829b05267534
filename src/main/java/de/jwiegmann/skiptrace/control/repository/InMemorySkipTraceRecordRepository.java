package de.jwiegmann.skiptrace.control.repository;

import de.jwiegmann.skiptrace.entity.SkipTraceRecord;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemorySkipTraceRecordRepository implements SkipTraceRecordRepository {

    // Map<batchId, Map<rowNumber, SkipTraceRecord>>
    private final Map<String, Map<Integer, SkipTraceRecord>> store = new ConcurrentHashMap<>();

    @Override
    public boolean saveIfAbsent(SkipTraceRecord record) {
        return store
                .computeIfAbsent(record.getBatchId(), k -> new ConcurrentHashMap<>())
                .putIfAbsent(record.getRowNumber(), record) == null;
    }

    @Override
    public Optional<SkipTraceRecord> find(String batchId, int rowNumber) {
        return Optional.ofNullable(store.getOrDefault(batchId, Map.of()).get(rowNumber));
    }

    @Override
    public List<SkipTraceRecord> findAll(String batchId) {
        return store.getOrDefault(batchId, Map.of()).values().stream()
                .sorted(Comparator.comparingInt(SkipTraceRecord::getRowNumber))
                .collect(Collectors.toList());
    }

    @Override
    public List<SkipTraceRecord> findPending(String batchId) {
        return findAll(batchId).stream()
                .filter(r -> r.getRowError() == null)
                .filter(SkipTraceRecord::isPending)
                .collect(Collectors.toList());
    }

    @Override
    public void deleteAll(String batchId) {
        store.remove(batchId);
    }
}
