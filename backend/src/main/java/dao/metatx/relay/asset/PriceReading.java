package dao.metatx.relay.asset;

import java.math.BigInteger;

/**
 * Raw feed answer, scaled by the feed's decimals. Not validated.
 *
 * @param updatedAt unix seconds of the round that produced {@code price}
 */
public record PriceReading(BigInteger price, long updatedAt) {}
