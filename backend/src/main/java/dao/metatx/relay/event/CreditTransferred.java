package dao.metatx.relay.event;

import java.math.BigInteger;

public record CreditTransferred(String emitter, String from, String to, BigInteger amount) implements LedgerEvent {}
