package dao.metatx.relay.chain;

import dao.metatx.relay.event.OwnershipTransferred;
import dao.metatx.relay.event.PauseChanged;
import dao.metatx.relay.exception.AuthorizationException;
import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.exception.PreconditionException;
import dao.metatx.relay.util.Addresses;
import lombok.extern.slf4j.Slf4j;

/**
 * Owner and pause state of one contract, passed explicitly into every operation that needs an
 * authorization check.
 */
@Slf4j
public class AdminConfig {

    private final LocalChain chain;
    private final String contractAddress;
    private final JournaledCell<String> owner;
    private final JournaledCell<Boolean> paused;
    private final JournaledCell<String> pauseReason;

    public AdminConfig(LocalChain chain, String contractAddress, String initialOwner) {
        this.chain = chain;
        this.contractAddress = Addresses.normalize(contractAddress);
        String ownerAddr = Addresses.normalize(initialOwner);
        if (Addresses.isZero(ownerAddr)) {
            throw new IllegalArgumentException("Owner cannot be the zero address");
        }
        this.owner = chain.newCell(ownerAddr);
        this.paused = chain.newCell(Boolean.FALSE);
        this.pauseReason = chain.newCell("");
    }

    public String owner() {
        return owner.get();
    }

    public boolean isPaused() {
        return paused.get();
    }

    public String pauseReason() {
        return pauseReason.get();
    }

    public void requireOwner(String caller) {
        if (!Addresses.same(caller, owner.get())) {
            throw new AuthorizationException(ErrorCode.NOT_OWNER, "caller " + caller + " is not the owner");
        }
    }

    public void requireNotPaused() {
        if (paused.get()) {
            throw new PreconditionException(ErrorCode.PAUSED, "paused: " + pauseReason.get());
        }
    }

    public void pause(String caller, String reason) {
        chain.transact(() -> {
            requireOwner(caller);
            requireNotPaused();
            String why = reason == null ? "" : reason.trim();
            paused.set(Boolean.TRUE);
            pauseReason.set(why);
            chain.getEvents().emit(new PauseChanged(contractAddress, Addresses.normalize(caller), true, why));
            log.warn("Contract {} paused by {}: {}", contractAddress, caller, why);
        });
    }

    public void unpause(String caller) {
        chain.transact(() -> {
            requireOwner(caller);
            if (!paused.get()) {
                throw new PreconditionException(ErrorCode.NOT_PAUSED, "contract is not paused");
            }
            paused.set(Boolean.FALSE);
            pauseReason.set("");
            chain.getEvents().emit(new PauseChanged(contractAddress, Addresses.normalize(caller), false, ""));
            log.info("Contract {} unpaused by {}", contractAddress, caller);
        });
    }

    public void transferOwnership(String caller, String newOwner) {
        chain.transact(() -> {
            requireOwner(caller);
            String next = Addresses.normalize(newOwner);
            if (Addresses.isZero(next)) {
                throw new PreconditionException(ErrorCode.ZERO_ADDRESS, "new owner is the zero address");
            }
            String previous = owner.get();
            owner.set(next);
            chain.getEvents().emit(new OwnershipTransferred(contractAddress, previous, next));
        });
    }
}
