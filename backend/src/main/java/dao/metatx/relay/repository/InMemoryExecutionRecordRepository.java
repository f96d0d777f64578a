package dao.metatx.relay.repository;

import dao.metatx.relay.model.BatchExecutionRecord;
import dao.metatx.relay.util.Addresses;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryExecutionRecordRepository implements ExecutionRecordRepository {

    // key: batchId
    private final Map<Long, BatchExecutionRecord> recordsByBatchId = new ConcurrentHashMap<>();

    // key: signer -> batchIds in execution order
    private final Map<String, List<Long>> batchIdsBySigner = new ConcurrentHashMap<>();

    @Override
    public synchronized void save(BatchExecutionRecord record) {
        recordsByBatchId.put(record.batchId(), record);
        batchIdsBySigner.computeIfAbsent(record.signer(), k -> new ArrayList<>()).add(record.batchId());
    }

    @Override
    public synchronized void delete(long batchId) {
        BatchExecutionRecord removed = recordsByBatchId.remove(batchId);
        if (removed == null) return;
        List<Long> ids = batchIdsBySigner.get(removed.signer());
        if (ids != null) {
            ids.remove(Long.valueOf(batchId));
        }
    }

    @Override
    public List<BatchExecutionRecord> findAll() {
        List<BatchExecutionRecord> all = new ArrayList<>(recordsByBatchId.values());
        all.sort(Comparator.comparingLong(BatchExecutionRecord::batchId));
        return all;
    }

    @Override
    public Optional<BatchExecutionRecord> findByBatchId(long batchId) {
        return Optional.ofNullable(recordsByBatchId.get(batchId));
    }

    @Override
    public synchronized List<BatchExecutionRecord> findBySigner(String signer) {
        List<Long> ids = batchIdsBySigner.get(Addresses.normalize(signer));
        if (ids == null) return List.of();
        List<BatchExecutionRecord> out = new ArrayList<>(ids.size());
        for (Long id : ids) {
            BatchExecutionRecord r = recordsByBatchId.get(id);
            if (r != null) out.add(r);
        }
        return out;
    }
}
