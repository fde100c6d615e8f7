package quest.gekko.iptv.service.integration.connector;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.iptv.exception.SourceUnavailableException;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

/**
 * Reads {@code file://} URIs and plain local paths. The timeout does not apply to local reads.
 */
@Slf4j
@Service
public class FileSourceFetcher implements SourceFetcher {

    @Override
    public Set<String> schemes() { return Set.of("file"); }

    @Override
    public byte[] fetch(final URI source, final Duration timeout) {
        final Path path = Path.of(source);
        if (!Files.isRegularFile(path)) {
            throw new SourceUnavailableException(source.toString(), "no such file");
        }
        try {
            log.debug("Reading {}", path);
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new SourceUnavailableException(source.toString(), e);
        }
    }
}
