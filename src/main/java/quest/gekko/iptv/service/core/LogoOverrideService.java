package quest.gekko.iptv.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.iptv.domain.AuditEntry;
import quest.gekko.iptv.domain.ChannelRecord;
import quest.gekko.iptv.domain.LogoOverride;
import quest.gekko.iptv.exception.ConfigInvalidException;
import quest.gekko.iptv.repository.TenantStore;
import quest.gekko.iptv.util.Tokens;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Administrative logo replacements. Changing an override drops the cached images of every channel it
 * currently matches, so the next render picks up the new logo.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogoOverrideService {
    private final TenantStore tenantStore;
    private final Clock clock;

    public LogoOverride create(final String tenant, final String pattern, final String logoUrl, final boolean regex,
                               final String actor) {
        if (pattern == null || pattern.isBlank()) throw new ConfigInvalidException("Override pattern is empty");
        if (regex) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new ConfigInvalidException("Invalid override regex '" + pattern + "': " + e.getDescription(), e);
            }
        }
        checkLogoUrl(logoUrl);

        final LogoOverride override = new LogoOverride(pattern.strip(), logoUrl.strip(), regex);
        tenantStore.saveLogoOverride(tenant, override);
        final long dropped = invalidateMatches(tenant, override);
        audit(tenant, actor, "logo-override.create", override, dropped);
        return override;
    }

    public boolean delete(final String tenant, final String pattern, final String actor) {
        final Optional<LogoOverride> removed = tenantStore.deleteLogoOverride(tenant, pattern);
        if (removed.isEmpty()) return false;
        final long dropped = invalidateMatches(tenant, removed.get());
        audit(tenant, actor, "logo-override.delete", removed.get(), dropped);
        return true;
    }

    public List<LogoOverride> list(final String tenant) {
        return tenantStore.getLogoOverrides(tenant);
    }

    /** Effective logo: an exact-id override, else the first matching regex override, else {@code fallback}. */
    public String resolveLogo(final String tenant, final String channelId, final String fallback) {
        final List<LogoOverride> overrides = tenantStore.getLogoOverrides(tenant);
        return overrides.stream()
                .filter(o -> !o.regex() && o.matches(channelId))
                .findFirst()
                .or(() -> overrides.stream().filter(o -> o.regex() && o.matches(channelId)).findFirst())
                .map(LogoOverride::logoUrl)
                .orElse(fallback);
    }

    public String resolveLogo(final String tenant, final ChannelRecord channel) {
        return resolveLogo(tenant, channel.channelId(), channel.logo());
    }

    private long invalidateMatches(final String tenant, final LogoOverride override) {
        final List<String> matching = tenantStore.getAllChannels(tenant).keySet().stream()
                .filter(override::matches)
                .toList();
        if (matching.isEmpty()) return 0;
        final long dropped = tenantStore.invalidateProcessedImages(matching);
        log.info("Override '{}' for tenant {} matches {} channels; dropped {} cached images",
                override.pattern(), Tokens.abbreviate(tenant), matching.size(), dropped);
        return dropped;
    }

    private static void checkLogoUrl(final String logoUrl) {
        if (logoUrl == null || logoUrl.isBlank()) throw new ConfigInvalidException("Override logo URL is empty");
        try {
            final URI uri = new URI(logoUrl.strip());
            if (uri.getScheme() == null || !uri.getScheme().toLowerCase(Locale.ROOT).startsWith("http")) {
                throw new ConfigInvalidException("Override logo must be an http(s) URL: " + logoUrl);
            }
        } catch (URISyntaxException e) {
            throw new ConfigInvalidException("Malformed override logo URL '" + logoUrl + "'", e);
        }
    }

    private void audit(final String tenant, final String actor, final String action, final LogoOverride override,
                       final long dropped) {
        tenantStore.appendAuditEntry(new AuditEntry(clock.instant(), actor, action, "tenant:" + Tokens.abbreviate(tenant),
                Map.of("pattern", override.pattern(), "regex", Boolean.toString(override.regex()),
                        "invalidated", Long.toString(dropped))));
    }
}
