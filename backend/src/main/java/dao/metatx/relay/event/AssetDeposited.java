package dao.metatx.relay.event;

import java.math.BigInteger;

public record AssetDeposited(
        String emitter,
        String account,
        String asset,
        BigInteger assetAmount,
        BigInteger creditsMinted
) implements LedgerEvent {}
