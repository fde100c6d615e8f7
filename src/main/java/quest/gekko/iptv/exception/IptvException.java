package quest.gekko.iptv.exception;

/**
 * Base type of the failures raised by ingestion and storage.
 */
public class IptvException extends RuntimeException {

    public IptvException(String message) {
        super(message);
    }

    public IptvException(String message, Throwable cause) {
        super(message, cause);
    }
}
