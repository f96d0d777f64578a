package dao.metatx.relay.service;

import dao.metatx.relay.chain.AdminConfig;
import dao.metatx.relay.chain.JournaledMap;
import dao.metatx.relay.chain.LocalChain;
import dao.metatx.relay.event.RelayerAuthorizationChanged;
import dao.metatx.relay.exception.AuthorizationException;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.exception.PreconditionException;
import dao.metatx.relay.util.Addresses;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Addresses allowed to submit on behalf of users. Empty until the owner adds someone.
 */
@Slf4j
public class RelayerRegistry {

    private final LocalChain chain;
    private final String contractAddress;
    private final AdminConfig admin;
    private final JournaledMap<String, Boolean> authorized;

    public RelayerRegistry(LocalChain chain, String contractAddress, AdminConfig admin) {
        this.chain = chain;
        this.contractAddress = Addresses.normalize(contractAddress);
        this.admin = admin;
        this.authorized = chain.newMap();
    }

    public void setAuthorization(String caller, String relayer, boolean allowed) {
        chain.transact(() -> {
            admin.requireOwner(caller);
            String addr = Addresses.normalize(relayer);
            if (Addresses.isZero(addr)) {
                throw new PreconditionException(ErrorCode.ZERO_ADDRESS, "relayer is the zero address");
            }
            if (allowed) {
                authorized.put(addr, Boolean.TRUE);
            } else {
                authorized.remove(addr);
            }
            chain.getEvents().emit(new RelayerAuthorizationChanged(contractAddress, addr, allowed));
            log.info("Relayer {} {} on {}", addr, allowed ? "authorized" : "revoked", contractAddress);
        });
    }

    public boolean isAuthorized(String relayer) {
        return Addresses.isValid(relayer) && authorized.containsKey(Addresses.normalize(relayer));
    }

    public void requireAuthorized(String relayer) {
        if (!isAuthorized(relayer)) {
            throw new AuthorizationException(ErrorCode.UNAUTHORIZED_RELAYER,
                    "caller " + relayer + " is not a whitelisted relayer");
        }
    }

    public List<String> authorizedRelayers() {
        return authorized.keys();
    }
}
