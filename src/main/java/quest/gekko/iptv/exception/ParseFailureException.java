package quest.gekko.iptv.exception;

public class ParseFailureException extends IptvException {

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
