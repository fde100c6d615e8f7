package quest.gekko.iptv.exception;

/**
 * Rejected tenant configuration: bad cron expression, source URI, timezone or token.
 */
public class ConfigInvalidException extends IptvException {

    public ConfigInvalidException(String message) {
        super(message);
    }

    public ConfigInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
