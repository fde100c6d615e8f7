package quest.gekko.iptv.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.gekko.iptv.service.integration.connector.SourceFetcher;
import quest.gekko.iptv.service.integration.connector.SourceResolver;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Configuration
public class ConnectorConfig {

    @Bean
    public SourceResolver sourceResolver(final List<SourceFetcher> fetchers) {
        final Map<String, SourceFetcher> byScheme = fetchers.stream()
                .flatMap(f -> f.schemes().stream().map(scheme -> Map.entry(scheme, f)))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
        return new SourceResolver(byScheme);
    }
}
