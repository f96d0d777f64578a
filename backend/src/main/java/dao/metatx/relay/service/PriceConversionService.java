package dao.metatx.relay.service;

import dao.metatx.relay.asset.PriceFeed;
import dao.metatx.relay.asset.PriceFeedException;
import dao.metatx.relay.asset.PriceReading;
import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.exception.OracleException;
import dao.metatx.relay.model.AssetWhitelistEntry;
import dao.metatx.relay.model.PriceQuote;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Turns asset amounts into credit units. Credits carry {@link #CREDIT_DECIMALS} decimals; asset
 * amounts are normalised to that precision before any price arithmetic, and every division rounds
 * toward zero.
 */
@Slf4j
public class PriceConversionService {

    public static final int CREDIT_DECIMALS = 18;

    private final LocalChain chain;
    @Getter
    private final long maxStalenessSeconds;

    public PriceConversionService(LocalChain chain, long maxStalenessSeconds) {
        if (maxStalenessSeconds <= 0) {
            throw new IllegalArgumentException("maxStalenessSeconds must be positive");
        }
        this.chain = chain;
        this.maxStalenessSeconds = maxStalenessSeconds;
    }

    public PriceQuote getPrice(AssetWhitelistEntry entry) {
        if (entry.priceFeed() == null) {
            throw new OracleException(ErrorCode.ORACLE_UNAVAILABLE, "no feed configured for " + entry.asset());
        }
        PriceFeed feed = chain.codeAt(entry.priceFeed(), PriceFeed.class)
                .orElseThrow(() -> new OracleException(ErrorCode.ORACLE_UNAVAILABLE,
                        "no feed deployed at " + entry.priceFeed()));

        PriceReading reading;
        try {
            reading = feed.latestReading();
        } catch (PriceFeedException e) {
            throw new OracleException(ErrorCode.ORACLE_UNAVAILABLE,
                    "feed " + entry.priceFeed() + " unreadable: " + e.getMessage(), e);
        }

        if (reading.price() == null || reading.price().signum() <= 0) {
            throw new OracleException(ErrorCode.INVALID_PRICE, "non-positive price " + reading.price());
        }
        long now = chain.now();
        if (reading.updatedAt() > now) {
            throw new OracleException(ErrorCode.INVALID_PRICE,
                    "price timestamp " + reading.updatedAt() + " is in the future");
        }
        if (reading.updatedAt() == 0 || now - reading.updatedAt() > maxStalenessSeconds) {
            throw new OracleException(ErrorCode.STALE_PRICE,
                    "price updated at " + reading.updatedAt() + " is older than " + maxStalenessSeconds + "s");
        }
        return new PriceQuote(reading.price(), reading.updatedAt(), feed.decimals());
    }

    /**
     * Fixed-unit assets never touch the feed.
     */
    public BigInteger toCredits(AssetWhitelistEntry entry, BigInteger amount) {
        BigInteger normalized = normalize(amount, entry.decimals());
        if (entry.fixedUnit()) {
            return normalized;
        }
        PriceQuote quote = getPrice(entry);
        BigInteger credits = normalized.multiply(quote.price()).divide(BigInteger.TEN.pow(quote.feedDecimals()));
        log.debug("Converted {} of {} at price {} ({} decimals) to {} credits",
                amount, entry.asset(), quote.price(), quote.feedDecimals(), credits);
        return credits;
    }

    static BigInteger normalize(BigInteger amount, int assetDecimals) {
        if (assetDecimals == CREDIT_DECIMALS) {
            return amount;
        }
        if (assetDecimals < CREDIT_DECIMALS) {
            return amount.multiply(BigInteger.TEN.pow(CREDIT_DECIMALS - assetDecimals));
        }
        return amount.divide(BigInteger.TEN.pow(assetDecimals - CREDIT_DECIMALS));
    }
}
