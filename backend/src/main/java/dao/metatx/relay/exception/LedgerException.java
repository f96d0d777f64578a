package dao.metatx.relay.exception;

import lombok.Getter;

/**
 * Base of every error the gateway and the vault surface to their immediate caller.
 * Raising one inside {@code LocalChain.transact} rolls back the whole operation.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode code;

    protected LedgerException(ErrorCode code, String message) {
        super(code.name() + ": " + message);
        this.code = code;
    }

    protected LedgerException(ErrorCode code, String message, Throwable cause) {
        super(code.name() + ": " + message, cause);
        this.code = code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
