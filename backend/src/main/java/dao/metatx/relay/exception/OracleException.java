package dao.metatx.relay.exception;

public class OracleException extends LedgerException {

    public OracleException(ErrorCode code, String message) {
        super(requireCategory(code), message);
    }

    public OracleException(ErrorCode code, String message, Throwable cause) {
        super(requireCategory(code), message, cause);
    }

    private static ErrorCode requireCategory(ErrorCode code) {
        if (code.getCategory() != ErrorCategory.ORACLE) {
            throw new IllegalArgumentException(code + " is not in category ORACLE");
        }
        return code;
    }
}
