package dao.metatx.relay.exception;

import lombok.Getter;

import static dao.metatx.relay.exception.ErrorCategory.*;

@Getter
public enum ErrorCode {
    EMPTY_BATCH(PRECONDITION),
    INVALID_TARGET(PRECONDITION),
    ZERO_ADDRESS(PRECONDITION),
    INVALID_AMOUNT(PRECONDITION),
    ZERO_CREDITS(PRECONDITION),
    UNSUPPORTED_ASSET(PRECONDITION),
    INVALID_ASSET(PRECONDITION),
    MISSING_PRICE_FEED(PRECONDITION),
    PAUSED(PRECONDITION),
    NOT_PAUSED(PRECONDITION),
    REENTRANCY(PRECONDITION),
    INSUFFICIENT_CREDITS(PRECONDITION),
    INSUFFICIENT_ASSET_BALANCE(PRECONDITION),

    UNAUTHORIZED_RELAYER(AUTHORIZATION),
    NOT_OWNER(AUTHORIZATION),
    EXPIRED(AUTHORIZATION),
    INVALID_NONCE(AUTHORIZATION),
    INVALID_SIGNATURE(AUTHORIZATION),

    INCORRECT_VALUE_SUPPLIED(VALUE_ACCOUNTING),
    INSUFFICIENT_NATIVE_BALANCE(VALUE_ACCOUNTING),
    REFUND_FAILED(VALUE_ACCOUNTING),
    TRANSFER_FAILED(VALUE_ACCOUNTING),

    STALE_PRICE(ORACLE),
    INVALID_PRICE(ORACLE),
    ORACLE_UNAVAILABLE(ORACLE);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }
}
