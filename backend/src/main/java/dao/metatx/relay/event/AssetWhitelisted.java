package dao.metatx.relay.event;

public record AssetWhitelisted(String emitter, String asset, String priceFeed, boolean fixedUnit) implements LedgerEvent {}
