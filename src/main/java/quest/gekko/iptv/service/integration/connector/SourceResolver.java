package quest.gekko.iptv.service.integration.connector;

import lombok.RequiredArgsConstructor;
import quest.gekko.iptv.exception.SourceUnavailableException;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Dispatches a source string to the fetcher registered for its scheme. Strings without a scheme
 * are treated as local paths.
 */
@RequiredArgsConstructor
public class SourceResolver {
    private final Map<String, SourceFetcher> fetchersByScheme;

    public byte[] fetch(final String source, final Duration timeout) {
        final URI uri = toUri(source);
        final String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        final SourceFetcher fetcher = fetchersByScheme.get(scheme);
        if (fetcher == null) {
            throw new SourceUnavailableException(source, "unsupported scheme '" + scheme + "'");
        }
        return fetcher.fetch(uri, timeout);
    }

    static URI toUri(final String source) {
        if (source == null || source.isBlank()) {
            throw new SourceUnavailableException(String.valueOf(source), "blank source");
        }
        final String trimmed = source.strip();
        try {
            final URI uri = new URI(trimmed);
            // Windows drive letters parse as a one-letter scheme
            if (uri.getScheme() != null && uri.getScheme().length() > 1) return uri;
        } catch (URISyntaxException e) {
            if (trimmed.contains("://")) throw new SourceUnavailableException(trimmed, e);
        }
        try {
            return Path.of(trimmed).toAbsolutePath().toUri();
        } catch (InvalidPathException e) {
            throw new SourceUnavailableException(trimmed, e);
        }
    }
}
