package dao.metatx.relay.event;

/**
 * Marker for everything the gateway, the vault and the in-process assets emit.
 */
public interface LedgerEvent {

    /** Address of the emitting contract. */
    String emitter();
}
