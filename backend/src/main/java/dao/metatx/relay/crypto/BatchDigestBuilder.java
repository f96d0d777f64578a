package dao.metatx.relay.crypto;

import dao.metatx.relay.model.BatchItem;
import dao.metatx.relay.util.Addresses;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.List;

import static dao.metatx.relay.util.CryptoUtil.addressWord;
import static dao.metatx.relay.util.CryptoUtil.concat;
import static dao.metatx.relay.util.CryptoUtil.keccak256;
import static dao.metatx.relay.util.CryptoUtil.uint256;

/**
 * EIP-712 encoding of a batch authorization.
 * <p>
 * Each item is hashed as its own struct before the array hash, so two batches with the same
 * concatenated call data but different item boundaries never share a digest.
 */
public final class BatchDigestBuilder {
    private BatchDigestBuilder() {}

    public static final String DOMAIN_TYPE =
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";
    public static final String BATCH_ITEM_TYPE = "BatchItem(address target,uint256 value,bytes data)";
    public static final String META_TRANSACTION_TYPE =
            "MetaTransaction(address from,BatchItem[] items,uint256 nonce,uint256 deadline)" + BATCH_ITEM_TYPE;

    private static final byte[] DOMAIN_TYPEHASH = keccak256(DOMAIN_TYPE);
    private static final byte[] BATCH_ITEM_TYPEHASH = keccak256(BATCH_ITEM_TYPE);
    private static final byte[] META_TRANSACTION_TYPEHASH = keccak256(META_TRANSACTION_TYPE);
    private static final byte[] EIP191_PREFIX = {0x19, 0x01};

    public static byte[] buildDigest(DomainContext domain,
                                     String signer,
                                     List<BatchItem> items,
                                     BigInteger nonce,
                                     long deadline) {
        byte[] structHash = keccak256(concat(
                META_TRANSACTION_TYPEHASH,
                addressWord(Addresses.normalize(signer)),
                hashItems(items),
                uint256(nonce),
                uint256(deadline)
        ));
        return keccak256(concat(EIP191_PREFIX, domainSeparator(domain), structHash));
    }

    public static byte[] domainSeparator(DomainContext domain) {
        return keccak256(concat(
                DOMAIN_TYPEHASH,
                keccak256(domain.name()),
                keccak256(domain.version()),
                uint256(domain.chainId()),
                addressWord(domain.verifyingContract())
        ));
    }

    public static byte[] hashItem(BatchItem item) {
        return keccak256(concat(
                BATCH_ITEM_TYPEHASH,
                addressWord(item.target()),
                uint256(item.value()),
                keccak256(item.payload())
        ));
    }

    static byte[] hashItems(List<BatchItem> items) {
        ByteArrayOutputStream packed = new ByteArrayOutputStream(items.size() * 32);
        for (BatchItem item : items) {
            packed.writeBytes(hashItem(item));
        }
        return keccak256(packed.toByteArray());
    }
}
