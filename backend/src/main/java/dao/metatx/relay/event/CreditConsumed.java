package dao.metatx.relay.event;

import java.math.BigInteger;

public record CreditConsumed(String emitter, String relayer, String account, BigInteger amount) implements LedgerEvent {}
