package dao.metatx.relay.event;

public record RelayerAuthorizationChanged(String emitter, String relayer, boolean authorized) implements LedgerEvent {}
