package dao.metatx.relay.asset;

/**
 * External price source. Readings are returned raw; freshness and sign checks belong to the caller.
 */
public interface PriceFeed {

    int decimals();

    PriceReading latestReading() throws PriceFeedException;
}
