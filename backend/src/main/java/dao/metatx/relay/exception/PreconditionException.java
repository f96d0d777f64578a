package dao.metatx.relay.exception;

public class PreconditionException extends LedgerException {

    public PreconditionException(ErrorCode code, String message) {
        super(requireCategory(code), message);
    }

    public PreconditionException(ErrorCode code, String message, Throwable cause) {
        super(requireCategory(code), message, cause);
    }

    private static ErrorCode requireCategory(ErrorCode code) {
        if (code.getCategory() != ErrorCategory.PRECONDITION) {
            throw new IllegalArgumentException(code + " is not in category PRECONDITION");
        }
        return code;
    }
}
