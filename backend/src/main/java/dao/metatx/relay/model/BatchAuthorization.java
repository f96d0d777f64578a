package dao.metatx.relay.model;

import dao.metatx.relay.util.Addresses;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * What the signer authorizes off-line. Consumed exactly once by the gateway; only the replay
 * counter outlives it.
 *
 * @param deadline unix seconds; the batch is rejected once the chain time passes it
 */
public record BatchAuthorization(String signer, List<BatchItem> items, BigInteger nonce, long deadline) {

    public BatchAuthorization {
        signer = Addresses.normalize(signer);
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        Objects.requireNonNull(nonce, "nonce");
        if (nonce.signum() < 0) {
            throw new IllegalArgumentException("nonce must be non-negative");
        }
    }
}
