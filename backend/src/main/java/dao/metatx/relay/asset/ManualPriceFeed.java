package dao.metatx.relay.asset;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Price feed whose answer is pushed by an operator (devnet bootstrap, tests).
 */
@Slf4j
public class ManualPriceFeed implements PriceFeed {

    private final int decimals;
    private BigInteger price;
    private long updatedAt;
    private boolean available = true;

    public ManualPriceFeed(int decimals, BigInteger price, long updatedAt) {
        this.decimals = decimals;
        this.price = price;
        this.updatedAt = updatedAt;
    }

    @Override
    public int decimals() {
        return decimals;
    }

    @Override
    public synchronized PriceReading latestReading() throws PriceFeedException {
        if (!available) {
            throw new PriceFeedException("feed unavailable");
        }
        return new PriceReading(price, updatedAt);
    }

    public synchronized void update(BigInteger newPrice, long newUpdatedAt) {
        this.price = newPrice;
        this.updatedAt = newUpdatedAt;
        log.debug("Feed updated: price={}, updatedAt={}", newPrice, newUpdatedAt);
    }

    /**
     * Re-publish the current answer with a new timestamp.
     */
    public synchronized void restamp(long newUpdatedAt) {
        this.updatedAt = newUpdatedAt;
    }

    public synchronized void setAvailable(boolean available) {
        this.available = available;
    }
}
