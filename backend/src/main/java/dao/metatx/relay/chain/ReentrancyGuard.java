package dao.metatx.relay.chain;

import dao.metatx.relay.exception.ErrorCode;
import dao.metatx.relay.exception.PreconditionException;

/**
 * Busy flag held around a contract's public entry points while they make external calls.
 */
public final class ReentrancyGuard {

    private final String contractName;
    private boolean entered;

    public ReentrancyGuard(String contractName) {
        this.contractName = contractName;
    }

    public void enter() {
        if (entered) {
            throw new PreconditionException(ErrorCode.REENTRANCY, contractName + " re-entered while busy");
        }
        entered = true;
    }

    public void exit() {
        entered = false;
    }

    public boolean isEntered() {
        return entered;
    }
}
