package quest.gekko.iptv.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for ingestion, event handling, storage and rate limiting
 */
@Configuration
@EnableConfigurationProperties({
        IptvProperties.Ingestion.class,
        IptvProperties.Events.class,
        IptvProperties.Store.class,
        IptvProperties.RateLimit.class
})
public class IptvProperties {

    @ConfigurationProperties("iptv.ingestion")
    public record Ingestion(
            @DefaultValue("10s") Duration fetchTimeout,
            @DefaultValue("30s") Duration epgFetchTimeout,
            @DefaultValue("4") int schedulerPoolSize,
            @DefaultValue("static") String staticDir,
            @DefaultValue("64MB") DataSize maxSourceSize) {}

    @ConfigurationProperties("iptv.events")
    public record Events(
            @DefaultValue("4h") Duration graceWindow,
            @DefaultValue("America/New_York") String displayZone,
            @DefaultValue({"EST", "EDT", "CST", "CDT", "MST", "MDT", "PST", "PDT", "UK", "UTC"}) List<String> zonePreference) {}

    @ConfigurationProperties("iptv.store")
    public record Store(
            @DefaultValue("redis") String backend,
            @DefaultValue("7d") Duration epgTtl,
            @DefaultValue("7d") Duration imageTtl,
            @DefaultValue("5m") Duration manifestTtl,
            @DefaultValue("90d") Duration auditTtl,
            @DefaultValue("3") int retryAttempts,
            @DefaultValue("200ms") Duration retryBackoff,
            @DefaultValue("2s") Duration retryMaxBackoff) {}

    @ConfigurationProperties("iptv.rate-limit")
    public record RateLimit(
            @DefaultValue("10") long requests,
            @DefaultValue("1h") Duration window) {}
}
