package dao.metatx.relay.event;

import java.math.BigInteger;

/**
 * Owner recovery of funds sent to a contract by mistake. {@code asset} is null for native value.
 */
public record AssetRescued(String emitter, String asset, String to, BigInteger amount) implements LedgerEvent {}
