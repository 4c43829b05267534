package de.jwiegmann.skiptrace.control.repository;

import de.jwiegmann.skiptrace.entity.UploadBatch;

import java.util.List;
import java.util.Optional;

public interface UploadBatchRepository {

    void save(UploadBatch batch);

    Optional<UploadBatch> find(String batchId);

    List<UploadBatch> findAll();

    boolean delete(String batchId);
}
