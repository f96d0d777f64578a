package dao.metatx.relay.exception;

public enum ErrorCategory {
    /** Bad input shape, rejected before any state change. */
    PRECONDITION,
    /** Bad signature, nonce, deadline, caller; rejected before dispatch. */
    AUTHORIZATION,
    /** Wrong attached value or a failed value movement; aborts the whole call. */
    VALUE_ACCOUNTING,
    /** Stale, invalid or unreadable price; aborts the specific deposit/withdraw. */
    ORACLE
}
