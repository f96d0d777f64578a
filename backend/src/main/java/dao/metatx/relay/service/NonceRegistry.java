package dao.metatx.relay.service;

import dao.metatx.relay.chain.JournaledMap;
import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.exception.AuthorizationException;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.util.Addresses;

import java.math.BigInteger;

/**
 * Per-signer replay counter. Nonces are used strictly in sequence: the only acceptable nonce is the
 * current one, and accepting it advances the counter by one.
 */
public class NonceRegistry {

    private final JournaledMap<String, BigInteger> nonces;

    public NonceRegistry(LocalChain chain) {
        this.nonces = chain.newMap();
    }

    public BigInteger nonceOf(String signer) {
        return nonces.getOrDefault(Addresses.normalize(signer), BigInteger.ZERO);
    }

    public void requireCurrent(String signer, BigInteger nonce) {
        BigInteger expected = nonceOf(signer);
        if (!expected.equals(nonce)) {
            throw new AuthorizationException(ErrorCode.INVALID_NONCE,
                    "expected nonce " + expected + " for " + signer + ", got " + nonce);
        }
    }

    /**
     * Must run inside a chain transaction so a later failure un-consumes the nonce.
     */
    public void consume(String signer, BigInteger nonce) {
        requireCurrent(signer, nonce);
        nonces.put(Addresses.normalize(signer), nonce.add(BigInteger.ONE));
    }
}
