package quest.gekko.iptv.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class HttpClientConfig {

    /** Playlists and guides are buffered whole, so the codec limit is raised to the configured source size. */
    @Bean
    public WebClient sourceWebClient(final WebClient.Builder builder, final IptvProperties.Ingestion ingestion) {
        final int maxBytes = (int) Math.min(Integer.MAX_VALUE, ingestion.maxSourceSize().toBytes());
        return builder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxBytes))
                .defaultHeader("User-Agent", "iptv-catalog-sync")
                .build();
    }
}
