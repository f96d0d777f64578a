package dao.metatx.relay.crypto;

import dao.metatx.relay.exception.AuthorizationException;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.util.Addresses;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.web3j.crypto.ECDSASignature;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Recovers the secp256k1 signer of a 32-byte digest from a 65-byte {@code r ‖ s ‖ v} signature.
 * Only canonical (low-s) signatures are accepted.
 */
public final class SignatureVerifier {
    private SignatureVerifier() {}

    private static final X9ECParameters CURVE = CustomNamedCurves.getByName("secp256k1");
    private static final BigInteger CURVE_ORDER = CURVE.getN();
    private static final BigInteger HALF_CURVE_ORDER = CURVE_ORDER.shiftRight(1);

    public static String recoverSigner(byte[] digest, byte[] signature) {
        if (digest == null || digest.length != 32) {
            throw invalid("digest must be 32 bytes");
        }
        if (signature == null || signature.length != 65) {
            throw invalid("signature must be 65 bytes");
        }
        BigInteger r = Numeric.toBigInt(Arrays.copyOfRange(signature, 0, 32));
        BigInteger s = Numeric.toBigInt(Arrays.copyOfRange(signature, 32, 64));
        int v = signature[64] & 0xff;
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw invalid("bad recovery id " + (signature[64] & 0xff));
        }
        if (r.signum() <= 0 || r.compareTo(CURVE_ORDER) >= 0 || s.signum() <= 0 || s.compareTo(CURVE_ORDER) >= 0) {
            throw invalid("r or s out of range");
        }
        if (s.compareTo(HALF_CURVE_ORDER) > 0) {
            throw invalid("malleable signature (high s)");
        }

        BigInteger publicKey;
        try {
            publicKey = Sign.recoverFromSignature(v - 27, new ECDSASignature(r, s), digest);
        } catch (IllegalArgumentException e) {
            throw new AuthorizationException(ErrorCode.INVALID_SIGNATURE, "recovery failed", e);
        }
        if (publicKey == null) {
            throw invalid("recovery failed");
        }
        String recovered = Numeric.prependHexPrefix(Keys.getAddress(publicKey));
        if (Addresses.isZero(recovered)) {
            throw invalid("recovered the zero address");
        }
        return Addresses.normalize(recovered);
    }

    private static AuthorizationException invalid(String why) {
        return new AuthorizationException(ErrorCode.INVALID_SIGNATURE, why);
    }
}
