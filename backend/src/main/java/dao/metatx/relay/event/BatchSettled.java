package dao.metatx.relay.event;

import java.math.BigInteger;

/**
 * Value accounting of one accepted batch: {@code totalRequired == totalUsed + refunded}.
 */
public record BatchSettled(
        String emitter,
        long batchId,
        String signer,
        String relayer,
        BigInteger totalRequired,
        BigInteger totalUsed,
        BigInteger refunded
) implements LedgerEvent {}
