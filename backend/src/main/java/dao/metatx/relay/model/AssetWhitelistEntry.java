package dao.metatx.relay.model;

/**
 * @param priceFeed  feed address, null for fixed-unit assets registered without one
 * @param fixedUnit  1 asset unit buys 1 credit unit (after decimal normalisation); the feed is ignored
 * @param decimals   asset decimals, captured when the asset is whitelisted
 */
public record AssetWhitelistEntry(String asset, String priceFeed, boolean fixedUnit, int decimals) {}
