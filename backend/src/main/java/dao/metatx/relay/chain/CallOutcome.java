package dao.metatx.relay.chain;

/**
 * Result of an isolated external call. Failure reasons are for logging only.
 */
public record CallOutcome(boolean success, String failureReason) {

    private static final CallOutcome SUCCESS = new CallOutcome(true, null);

    public static CallOutcome succeeded() {
        return SUCCESS;
    }

    public static CallOutcome failed(String reason) {
        return new CallOutcome(false, reason == null ? "reverted" : reason);
    }
}
