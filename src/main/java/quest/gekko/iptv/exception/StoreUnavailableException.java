package quest.gekko.iptv.exception;

/**
 * The backing key-value store could not be reached.
 */
public class StoreUnavailableException extends IptvException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
