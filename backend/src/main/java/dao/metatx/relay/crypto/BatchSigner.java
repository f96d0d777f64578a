package dao.metatx.relay.crypto;

import dao.metatx.relay.model.BatchAuthorization;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Sign;

/**
 * Off-line side: what a user's wallet does to authorize a batch.
 */
public final class BatchSigner {
    private BatchSigner() {}

    /**
     * @return 65-byte {@code r ‖ s ‖ v} signature over the batch digest, v in {27, 28}
     */
    public static byte[] sign(Credentials credentials, DomainContext domain, BatchAuthorization authorization) {
        byte[] digest = BatchDigestBuilder.buildDigest(
                domain,
                authorization.signer(),
                authorization.items(),
                authorization.nonce(),
                authorization.deadline());
        return signDigest(credentials, digest);
    }

    public static byte[] signDigest(Credentials credentials, byte[] digest) {
        Sign.SignatureData sig = Sign.signMessage(digest, credentials.getEcKeyPair(), false);
        byte[] out = new byte[65];
        System.arraycopy(sig.getR(), 0, out, 0, 32);
        System.arraycopy(sig.getS(), 0, out, 32, 32);
        out[64] = sig.getV()[0];
        return out;
    }
}
