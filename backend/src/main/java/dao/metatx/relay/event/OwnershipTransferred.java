package dao.metatx.relay.event;

public record OwnershipTransferred(String emitter, String previousOwner, String newOwner) implements LedgerEvent {}
