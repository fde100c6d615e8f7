package quest.gekko.iptv.service.integration.connector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import quest.gekko.iptv.exception.SourceUnavailableException;

import java.net.URI;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
@RequiredArgsConstructor
public class HttpSourceFetcher implements SourceFetcher {
    private final WebClient http;

    @Override
    public Set<String> schemes() { return Set.of("http", "https"); }

    @Override
    public byte[] fetch(final URI source, final Duration timeout) {
        log.debug("GET {}", source);
        try {
            final byte[] body = http.get()
                    .uri(source)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .timeout(timeout)
                    .block();
            if (body == null) throw new SourceUnavailableException(source.toString(), "empty response");
            return body;
        } catch (WebClientResponseException e) {
            throw new SourceUnavailableException(source.toString(), "HTTP " + e.getStatusCode().value());
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            // block() rethrows checked failures wrapped, e.g. TimeoutException
            final Throwable cause = e.getCause() instanceof TimeoutException ? e.getCause() : e;
            throw new SourceUnavailableException(source.toString(), cause);
        }
    }
}
