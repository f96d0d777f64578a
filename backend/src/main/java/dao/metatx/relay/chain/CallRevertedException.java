package dao.metatx.relay.chain;

/**
 * Raised by contract code to revert the current call.
 */
public class CallRevertedException extends RuntimeException {

    public CallRevertedException(String reason) {
        super(reason);
    }
}
