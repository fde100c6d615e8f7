package quest.gekko.iptv.domain;

import java.util.List;

/**
 * A tenant's ingestion configuration. Replaced wholesale on update.
 *
 * @param sources        ordered playlist source URIs
 * @param cronSchedule   5-field cron expression driving scheduled ingestion
 * @param baseUrl        external base URL used for derived asset links
 * @param credentialHash optional hash of the tenant's addon password
 * @param timezone       optional IANA zone; also the zone the cron schedule is evaluated in
 */
public record TenantConfig(
        List<String> sources,
        String cronSchedule,
        String baseUrl,
        String credentialHash,
        String timezone
) {
    public static final String DEFAULT_SCHEDULE = "0 */6 * * *";

    public TenantConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
        cronSchedule = cronSchedule == null ? DEFAULT_SCHEDULE : cronSchedule.trim();
    }

    public static TenantConfig of(List<String> sources, String baseUrl) {
        return new TenantConfig(sources, DEFAULT_SCHEDULE, baseUrl, null, null);
    }
}
