package dao.metatx.relay.event;

import java.math.BigInteger;

/**
 * Emitted once per dispatched batch item, whatever its outcome.
 */
public record MetaTransactionExecuted(
        String emitter,
        String relayer,
        String signer,
        String target,
        BigInteger value,
        String payloadHex,
        boolean success
) implements LedgerEvent {}
