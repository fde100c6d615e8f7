package quest.gekko.iptv.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.iptv.domain.CatalogManifest;
import quest.gekko.iptv.domain.ChannelRecord;
import quest.gekko.iptv.repository.TenantStore;
import quest.gekko.iptv.util.Tokens;

import java.util.Collection;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Catalog summary read through the manifest cache. A rebuild racing with an ingestion can cache a
 * summary of the previous channel set; the entry's short TTL bounds that.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManifestService {
    private final TenantStore tenantStore;

    public CatalogManifest getManifest(final String tenant) {
        final Optional<CatalogManifest> cached = tenantStore.getManifest(tenant);
        if (cached.isPresent()) return cached.get();

        final CatalogManifest manifest = build(tenantStore.getAllChannels(tenant).values());
        tenantStore.storeManifest(tenant, manifest);
        log.debug("Rebuilt manifest for tenant {}: {} channel genres, {} event genres",
                Tokens.abbreviate(tenant), manifest.channelGenres().size(), manifest.eventGenres().size());
        return manifest;
    }

    static CatalogManifest build(final Collection<ChannelRecord> channels) {
        final TreeSet<String> channelGenres = new TreeSet<>();
        final TreeSet<String> eventGenres = new TreeSet<>();
        for (ChannelRecord channel : channels) {
            if (channel.event()) {
                if (channel.eventSport() != null && !channel.eventSport().isBlank()) eventGenres.add(channel.eventSport());
            } else if (channel.group() != null && !channel.group().isBlank()) {
                channelGenres.add(channel.group());
            }
        }
        return new CatalogManifest(channelGenres.stream().toList(), eventGenres.stream().toList());
    }
}
