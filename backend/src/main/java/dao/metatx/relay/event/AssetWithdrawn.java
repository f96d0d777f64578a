package dao.metatx.relay.event;

import java.math.BigInteger;

public record AssetWithdrawn(
        String emitter,
        String account,
        String asset,
        BigInteger assetAmount,
        BigInteger creditsBurned
) implements LedgerEvent {}
