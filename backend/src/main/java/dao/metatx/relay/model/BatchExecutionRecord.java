package dao.metatx.relay.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Audit trail of one accepted batch. Immutable once created.
 */
public record BatchExecutionRecord(
        long batchId,
        String signer,
        String relayer,
        int itemCount,
        BigInteger totalValueRequired,
        BigInteger totalValueUsed,
        BigInteger refunded,
        List<Boolean> perItemSuccess,
        long executedAt
) {

    public BatchExecutionRecord {
        perItemSuccess = List.copyOf(perItemSuccess);
    }

    public long successCount() {
        return perItemSuccess.stream().filter(Boolean::booleanValue).count();
    }
}
