package dao.metatx.relay.event;

import java.math.BigInteger;

public record Approval(String emitter, String owner, String spender, BigInteger amount) implements LedgerEvent {}
