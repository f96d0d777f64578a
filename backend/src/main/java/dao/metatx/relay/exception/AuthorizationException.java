package dao.metatx.relay.exception;

public class AuthorizationException extends LedgerException {

    public AuthorizationException(ErrorCode code, String message) {
        super(requireCategory(code), message);
    }

    public AuthorizationException(ErrorCode code, String message, Throwable cause) {
        super(requireCategory(code), message, cause);
    }

    private static ErrorCode requireCategory(ErrorCode code) {
        if (code.getCategory() != ErrorCategory.AUTHORIZATION) {
            throw new IllegalArgumentException(code + " is not in category AUTHORIZATION");
        }
        return code;
    }
}
