package quest.gekko.iptv.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.gekko.iptv.repository.TtlPolicy;
import quest.gekko.iptv.service.parsing.ChannelMatcher;
import quest.gekko.iptv.service.parsing.EpgParser;
import quest.gekko.iptv.service.parsing.EventTimeExtractor;
import quest.gekko.iptv.service.parsing.PlaylistParser;
import quest.gekko.iptv.service.parsing.ZonePreference;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ParsingConfig {

    @Bean
    public ZonePreference zonePreference(final IptvProperties.Events events) {
        return new ZonePreference(events.zonePreference());
    }

    @Bean
    public EventTimeExtractor eventTimeExtractor(final ZonePreference zonePreference, final Clock clock) {
        return new EventTimeExtractor(zonePreference, clock);
    }

    @Bean
    public PlaylistParser playlistParser(final EventTimeExtractor extractor, final TtlPolicy ttlPolicy, final Clock clock,
                                         final IptvProperties.Ingestion ingestion, final IptvProperties.Events events) {
        return new PlaylistParser(extractor, ttlPolicy, clock, Path.of(ingestion.staticDir()), ZoneId.of(events.displayZone()));
    }

    @Bean
    public EpgParser epgParser(final Clock clock) {
        return new EpgParser(clock);
    }

    @Bean
    public ChannelMatcher channelMatcher() {
        return new ChannelMatcher();
    }
}
