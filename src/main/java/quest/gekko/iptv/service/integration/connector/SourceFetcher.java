package quest.gekko.iptv.service.integration.connector;

import java.net.URI;
import java.time.Duration;
import java.util.Set;

/**
 * Fetches the raw bytes of a playlist or guide source.
 */
public interface SourceFetcher {

    /** Lower-case URI schemes this fetcher handles. */
    Set<String> schemes();

    /**
     * @throws quest.gekko.iptv.exception.SourceUnavailableException when the source cannot be read
     *         within {@code timeout}
     */
    byte[] fetch(URI source, Duration timeout);
}
