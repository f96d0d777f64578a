package dao.metatx.relay.chain;

import java.math.BigInteger;

/**
 * One external call as seen by the callee.
 *
 * @param caller     immediate caller (msg.sender)
 * @param target     the address being called
 * @param value      native value moved to {@code target} before the code runs
 * @param payload    opaque call data
 * @param onBehalfOf original signer when the caller forwards a meta-transaction, otherwise null
 */
public record CallContext(
        String caller,
        String target,
        BigInteger value,
        byte[] payload,
        String onBehalfOf
) {

    public boolean hasPayload() {
        return payload != null && payload.length > 0;
    }
}
