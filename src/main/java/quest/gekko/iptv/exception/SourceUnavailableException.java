package quest.gekko.iptv.exception;

/**
 * A playlist or guide source could not be fetched.
 */
public class SourceUnavailableException extends IptvException {

    private final String source;

    public SourceUnavailableException(String source, String message) {
        super("Source unavailable: " + source + " (" + message + ")");
        this.source = source;
    }

    public SourceUnavailableException(String source, Throwable cause) {
        super("Source unavailable: " + source + " (" + cause.getMessage() + ")", cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
