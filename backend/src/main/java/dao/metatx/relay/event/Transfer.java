package dao.metatx.relay.event;

import java.math.BigInteger;

public record Transfer(String emitter, String from, String to, BigInteger amount) implements LedgerEvent {}
