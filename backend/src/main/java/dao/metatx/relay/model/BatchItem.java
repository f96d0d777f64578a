package dao.metatx.relay.model;

import dao.metatx.relay.util.Addresses;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * One call to make on behalf of the signer.
 */
public record BatchItem(String target, BigInteger value, byte[] payload) {

    public BatchItem {
        target = Addresses.normalize(target);
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must be non-negative, got " + value);
        }
        payload = payload == null ? new byte[0] : payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * A value transfer or a payload to the zero address is never legal.
     */
    public boolean hasValidTarget() {
        return !Addresses.isZero(target) || (value.signum() == 0 && payload.length == 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BatchItem other)) return false;
        return target.equals(other.target) && value.equals(other.value) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(target, value) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "BatchItem[target=" + target + ", value=" + value + ", payloadBytes=" + payload.length + "]";
    }
}
