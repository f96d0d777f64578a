package dao.metatx.relay.model;

import java.math.BigInteger;

/**
 * @param creditsCharged gas credits taken from the signer for this batch, zero when charging is off
 */
public record RelayOutcome(BatchExecutionRecord record, BigInteger creditsCharged) {}
