package quest.gekko.iptv.service.core;

import org.springframework.stereotype.Component;
import quest.gekko.iptv.domain.TenantConfig;
import quest.gekko.iptv.exception.ConfigInvalidException;
import quest.gekko.iptv.service.scheduling.CronSchedules;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;

/**
 * Checks a tenant config before it is stored and returns its normalized form.
 */
@Component
public class TenantConfigValidator {

    public static final int MAX_SOURCES = 50;

    public TenantConfig validate(final TenantConfig config) {
        if (config == null) throw new ConfigInvalidException("Tenant config is missing");

        final List<String> sources = config.sources().stream().map(String::strip).toList();
        if (sources.isEmpty()) throw new ConfigInvalidException("At least one source is required");
        if (sources.size() > MAX_SOURCES) {
            throw new ConfigInvalidException("At most " + MAX_SOURCES + " sources are allowed, got " + sources.size());
        }
        sources.forEach(TenantConfigValidator::checkSource);

        CronSchedules.toSpringCron(config.cronSchedule());

        final String timezone = config.timezone() == null || config.timezone().isBlank() ? null : config.timezone().strip();
        if (timezone != null) {
            try {
                ZoneId.of(timezone);
            } catch (DateTimeException e) {
                throw new ConfigInvalidException("Unknown timezone '" + timezone + "'", e);
            }
        }

        return new TenantConfig(sources, config.cronSchedule(), normalizeBaseUrl(config.baseUrl()),
                config.credentialHash(), timezone);
    }

    static void checkSource(final String source) {
        if (source.isEmpty()) throw new ConfigInvalidException("Source URI is empty");
        final URI uri;
        try {
            uri = new URI(source);
        } catch (URISyntaxException e) {
            throw new ConfigInvalidException("Malformed source URI '" + source + "'", e);
        }
        final String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        switch (scheme) {
            case "http", "https" -> {
                if (uri.getHost() == null) throw new ConfigInvalidException("Source URI has no host: " + source);
            }
            case "file" -> {
                if (uri.getPath() == null || uri.getPath().isEmpty()) {
                    throw new ConfigInvalidException("File source has no path: " + source);
                }
            }
            default -> throw new ConfigInvalidException("Unsupported source scheme '" + scheme + "': " + source);
        }
    }

    static String normalizeBaseUrl(final String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) throw new ConfigInvalidException("Base URL is required");
        final String stripped = baseUrl.strip().replaceAll("/+$", "");
        try {
            final URI uri = new URI(stripped);
            final String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
                throw new ConfigInvalidException("Base URL must be an absolute http(s) URL: " + baseUrl);
            }
        } catch (URISyntaxException e) {
            throw new ConfigInvalidException("Malformed base URL '" + baseUrl + "'", e);
        }
        return stripped;
    }
}
