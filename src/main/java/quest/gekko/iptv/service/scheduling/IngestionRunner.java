package quest.gekko.iptv.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.iptv.config.IptvProperties;
import quest.gekko.iptv.domain.ChannelRecord;
import quest.gekko.iptv.domain.IngestionOutcome;
import quest.gekko.iptv.domain.IngestionReport;
import quest.gekko.iptv.domain.ProgramEntry;
import quest.gekko.iptv.domain.TenantConfig;
import quest.gekko.iptv.exception.ParseFailureException;
import quest.gekko.iptv.exception.SourceUnavailableException;
import quest.gekko.iptv.exception.StoreUnavailableException;
import quest.gekko.iptv.repository.TenantStore;
import quest.gekko.iptv.service.integration.connector.SourceResolver;
import quest.gekko.iptv.service.parsing.ChannelMatcher;
import quest.gekko.iptv.service.parsing.EpgParser;
import quest.gekko.iptv.service.parsing.ParsedPlaylist;
import quest.gekko.iptv.service.parsing.PlaylistParser;
import quest.gekko.iptv.util.Tokens;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One ingestion cycle for one tenant: playlists, then guides, then cache invalidation.
 * A failing source is logged and skipped; a cycle that yields no channel leaves the stored catalog alone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionRunner {
    private final SourceResolver sources;
    private final PlaylistParser playlistParser;
    private final EpgParser epgParser;
    private final ChannelMatcher channelMatcher;
    private final TenantStore tenantStore;
    private final IptvProperties.Ingestion ingestion;
    private final Clock clock;

    public IngestionReport run(final String tenant, final TenantConfig config) {
        final String who = Tokens.abbreviate(tenant);
        log.info("Ingestion started for tenant {} ({} sources)", who, config.sources().size());
        final List<String> errors = new ArrayList<>();

        final Map<String, ChannelRecord> channels = new LinkedHashMap<>();
        final Set<String> epgUrls = new LinkedHashSet<>();
        for (String source : config.sources()) {
            try {
                final byte[] body = sources.fetch(source, ingestion.fetchTimeout());
                final ParsedPlaylist playlist = playlistParser.parse(new String(body, StandardCharsets.UTF_8), config.baseUrl());
                playlist.channels().forEach(c -> channels.put(c.channelId(), c));
                epgUrls.addAll(playlist.epgUrls());
                log.info("Source {} gave {} channels", source, playlist.channels().size());
            } catch (SourceUnavailableException | ParseFailureException e) {
                log.warn("Skipping playlist {} for tenant {}: {}", source, who, e.getMessage());
                errors.add("playlist " + source + ": " + e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected failure on playlist {} for tenant {}", source, who, e);
                errors.add("playlist " + source + ": " + e);
            }
        }

        if (channels.isEmpty()) {
            errors.add("no channels parsed from any source");
            log.error("Ingestion for tenant {} produced no channels; keeping the stored catalog", who);
            return finish(tenant, IngestionOutcome.FATAL, 0, 0, errors);
        }

        try {
            final List<ChannelRecord> catalog = new ArrayList<>(channels.values());
            final int stored = tenantStore.storeChannels(tenant, catalog);

            catalog.stream().map(ChannelRecord::guideUrl).filter(u -> u != null && !u.isBlank()).forEach(epgUrls::add);
            final Map<String, List<ProgramEntry>> programs = ingestGuides(tenant, epgUrls, catalog, errors);
            final int programCount = programs.values().stream().mapToInt(List::size).sum();
            if (!programs.isEmpty()) {
                tenantStore.storeEpg(tenant, programs);
            }

            tenantStore.invalidateManifest(tenant);
            final IngestionOutcome outcome = errors.isEmpty() ? IngestionOutcome.SUCCESS : IngestionOutcome.PARTIAL_FAILURE;
            return finish(tenant, outcome, stored, programCount, errors);
        } catch (StoreUnavailableException e) {
            log.error("Store unavailable during ingestion for tenant {}: {}", who, e.getMessage());
            errors.add("store: " + e.getMessage());
            return finish(tenant, IngestionOutcome.FATAL, 0, 0, errors);
        }
    }

    private Map<String, List<ProgramEntry>> ingestGuides(final String tenant, final Set<String> urls,
                                                         final List<ChannelRecord> catalog, final List<String> errors) {
        final Map<String, List<ProgramEntry>> programs = new LinkedHashMap<>();
        for (String url : urls) {
            try {
                final Map<String, List<ProgramEntry>> parsed = epgParser.parse(sources.fetch(url, ingestion.epgFetchTimeout()));
                if (parsed.isEmpty()) {
                    log.warn("Guide {} for tenant {} yielded no programs", url, Tokens.abbreviate(tenant));
                    continue;
                }
                channelMatcher.merge(parsed, catalog)
                        .forEach((channelId, list) -> programs.computeIfAbsent(channelId, k -> new ArrayList<>()).addAll(list));
            } catch (SourceUnavailableException e) {
                log.warn("Skipping guide {} for tenant {}: {}", url, Tokens.abbreviate(tenant), e.getMessage());
                errors.add("epg " + url + ": " + e.getMessage());
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Unexpected failure on guide {} for tenant {}", url, Tokens.abbreviate(tenant), e);
                errors.add("epg " + url + ": " + e);
            }
        }
        programs.values().forEach(list -> list.sort(Comparator.comparing(ProgramEntry::start)));
        return programs;
    }

    private IngestionReport finish(final String tenant, final IngestionOutcome outcome, final int channels,
                                   final int programs, final List<String> errors) {
        final IngestionReport report = new IngestionReport(clock.instant(), outcome, channels, programs, errors);
        tenantStore.appendParseHistory(tenant, report);
        log.info("Ingestion for tenant {} finished: {} ({} channels, {} programs, {} errors)",
                Tokens.abbreviate(tenant), outcome, channels, programs, errors.size());
        return report;
    }
}
