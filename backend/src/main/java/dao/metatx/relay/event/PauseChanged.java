package dao.metatx.relay.event;

public record PauseChanged(String emitter, String by, boolean paused, String reason) implements LedgerEvent {}
