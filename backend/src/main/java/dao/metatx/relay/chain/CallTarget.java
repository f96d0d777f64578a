package dao.metatx.relay.chain;

/**
 * Code deployed at an address. Throwing from {@link #onCall} reverts the call: the chain rolls back
 * everything the call did, including the attached value transfer.
 */
@FunctionalInterface
public interface CallTarget {

    void onCall(CallContext context);
}
