package de.jwiegmann.skiptrace.control.repository;

import de.jwiegmann.skiptrace.entity.UploadBatch;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryUploadBatchRepository implements UploadBatchRepository {

    // Map<batchId, UploadBatch>
    private final Map<String, UploadBatch> store = new ConcurrentHashMap<>();

    @Override
    public void save(UploadBatch batch) {
        store.put(batch.getBatchId(), batch);
    }

    @Override
    public Optional<UploadBatch> find(String batchId) {
        return Optional.ofNullable(store.get(batchId));
    }

    @Override
    public List<UploadBatch> findAll() {
        return store.values().stream()
                .sorted(Comparator.comparing(UploadBatch::getCreatedAt))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public boolean delete(String batchId) {
        return store.remove(batchId) != null;
    }
}
