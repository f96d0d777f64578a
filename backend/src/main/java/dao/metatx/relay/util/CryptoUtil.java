package dao.metatx.relay.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Byte-level helpers shared by the digest builder, the signature verifier and the ABI-aware assets.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    public static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    public static byte[] keccak256(String utf8) {
        return keccak256(utf8.getBytes(StandardCharsets.UTF_8));
    }

    public static String toHex0x(byte[] bytes) {
        StringBuilder sb = new StringBuilder("0x");
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }

    /**
     * Left-pad an unsigned integer to a 32-byte word (uint256 encoding).
     */
    public static byte[] uint256(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("uint256 cannot be negative");
        }
        byte[] raw = value.toByteArray();
        int start = (raw.length > 1 && raw[0] == 0) ? 1 : 0;
        int len = raw.length - start;
        if (len > 32) {
            throw new IllegalArgumentException("Value exceeds 256 bits");
        }
        byte[] word = new byte[32];
        System.arraycopy(raw, start, word, 32 - len, len);
        return word;
    }

    public static byte[] uint256(long value) {
        return uint256(BigInteger.valueOf(value));
    }

    /**
     * Address as a left-padded 32-byte word (abi.encode of address).
     */
    public static byte[] addressWord(String address) {
        byte[] addr20 = Numeric.hexStringToByteArray(Addresses.normalize(address));
        byte[] word = new byte[32];
        System.arraycopy(addr20, 0, word, 12, 20);
        return word;
    }

    public static byte[] concat(byte[]... parts) {
        int len = 0;
        for (byte[] p : parts) len += p.length;
        byte[] out = new byte[len];
        int pos = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }
}
