package dao.metatx.relay.repository;

import dao.metatx.relay.model.BatchExecutionRecord;

import java.util.List;
import java.util.Optional;

public interface ExecutionRecordRepository {

    void save(BatchExecutionRecord record);

    void delete(long batchId);

    List<BatchExecutionRecord> findAll();

    Optional<BatchExecutionRecord> findByBatchId(long batchId);

    List<BatchExecutionRecord> findBySigner(String signer);
}
