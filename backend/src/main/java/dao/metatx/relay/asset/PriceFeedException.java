package dao.metatx.relay.asset;

/**
 * The feed could not be read at all.
 */
public class PriceFeedException extends Exception {

    public PriceFeedException(String message) {
        super(message);
    }

    public PriceFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
