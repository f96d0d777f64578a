package dao.metatx.relay.event;

import java.math.BigInteger;

public record ConsumedCreditsWithdrawn(String emitter, String owner, String asset, BigInteger assetAmount) implements LedgerEvent {}
