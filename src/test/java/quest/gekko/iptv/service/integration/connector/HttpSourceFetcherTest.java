package quest.gekko.iptv.service.integration.connector;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.iptv.exception.SourceUnavailableException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpSourceFetcherTest {

    private static final URI SOURCE = URI.create("http://provider.example/list.m3u");

    private static HttpSourceFetcher fetcher(final ExchangeFunction exchange) {
        return new HttpSourceFetcher(WebClient.builder().exchangeFunction(exchange).build());
    }

    @Test
    void returnsResponseBody() {
        final HttpSourceFetcher fetcher = fetcher(request ->
                Mono.just(ClientResponse.create(HttpStatus.OK).body("#EXTM3U\n").build()));

        assertThat(fetcher.fetch(SOURCE, Duration.ofSeconds(1))).isEqualTo("#EXTM3U\n".getBytes(StandardCharsets.UTF_8));
        assertThat(fetcher.schemes()).containsExactlyInAnyOrder("http", "https");
    }

    @Test
    void errorStatusIsUnavailable() {
        final HttpSourceFetcher fetcher = fetcher(request -> Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build()));

        assertThatThrownBy(() -> fetcher.fetch(SOURCE, Duration.ofSeconds(1)))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("HTTP 404");
    }

    @Test
    void slowSourceTimesOut() {
        final HttpSourceFetcher fetcher = fetcher(request -> Mono.never());

        assertThatThrownBy(() -> fetcher.fetch(SOURCE, Duration.ofMillis(50)))
                .isInstanceOf(SourceUnavailableException.class)
                .satisfies(e -> assertThat(((SourceUnavailableException) e).getSource()).isEqualTo(SOURCE.toString()));
    }
}
