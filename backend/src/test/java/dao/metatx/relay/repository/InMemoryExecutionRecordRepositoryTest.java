package dao.metatx.relay.repository;

import dao.metatx.relay.model.BatchExecutionRecord;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryExecutionRecordRepositoryTest {

    private static final String SIGNER_A = "0x" + "aa".repeat(20);
    private static final String SIGNER_B = "0x" + "bb".repeat(20);
    private static final String RELAYER = "0x" + "cc".repeat(20);

    private static BatchExecutionRecord record(long id, String signer) {
        return new BatchExecutionRecord(id, signer, RELAYER, 1, BigInteger.ONE, BigInteger.ONE,
                BigInteger.ZERO, List.of(true), 1_700_000_000L + id);
    }

    @Test
    void findAll_ordersByBatchId() {
        InMemoryExecutionRecordRepository repo = new InMemoryExecutionRecordRepository();
        repo.save(record(3, SIGNER_A));
        repo.save(record(1, SIGNER_B));
        repo.save(record(2, SIGNER_A));

        assertEquals(List.of(1L, 2L, 3L), repo.findAll().stream().map(BatchExecutionRecord::batchId).toList());
    }

    @Test
    void findBySigner_isCaseInsensitiveAndKeepsExecutionOrder() {
        InMemoryExecutionRecordRepository repo = new InMemoryExecutionRecordRepository();
        repo.save(record(1, SIGNER_A));
        repo.save(record(2, SIGNER_B));
        repo.save(record(3, SIGNER_A));

        List<BatchExecutionRecord> found = repo.findBySigner(SIGNER_A.toUpperCase().replace("0X", "0x"));
        assertEquals(List.of(1L, 3L), found.stream().map(BatchExecutionRecord::batchId).toList());
        assertTrue(repo.findBySigner(RELAYER).isEmpty());
    }

    @Test
    void delete_removesFromBothIndexes() {
        InMemoryExecutionRecordRepository repo = new InMemoryExecutionRecordRepository();
        repo.save(record(1, SIGNER_A));

        repo.delete(1);
        repo.delete(42);

        assertTrue(repo.findByBatchId(1).isEmpty());
        assertTrue(repo.findBySigner(SIGNER_A).isEmpty());
    }
}
