package dao.metatx.relay.crypto;

import dao.metatx.relay.util.Addresses;

/**
 * EIP-712 domain binding a signature to one deployment on one network.
 */
public record DomainContext(String name, String version, long chainId, String verifyingContract) {

    public DomainContext {
        verifyingContract = Addresses.normalize(verifyingContract);
    }
}
