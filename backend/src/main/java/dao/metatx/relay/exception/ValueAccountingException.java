package dao.metatx.relay.exception;

public class ValueAccountingException extends LedgerException {

    public ValueAccountingException(ErrorCode code, String message) {
        super(requireCategory(code), message);
    }

    public ValueAccountingException(ErrorCode code, String message, Throwable cause) {
        super(requireCategory(code), message, cause);
    }

    private static ErrorCode requireCategory(ErrorCode code) {
        if (code.getCategory() != ErrorCategory.VALUE_ACCOUNTING) {
            throw new IllegalArgumentException(code + " is not in category VALUE_ACCOUNTING");
        }
        return code;
    }
}
