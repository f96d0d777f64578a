package dao.metatx.relay.model;

import java.math.BigInteger;

/**
 * A validated feed reading: positive and fresh at the time it was taken.
 */
public record PriceQuote(BigInteger price, long updatedAt, int feedDecimals) {}
