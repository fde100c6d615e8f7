package quest.gekko.iptv.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.iptv.domain.AuditEntry;
import quest.gekko.iptv.domain.IngestionReport;
import quest.gekko.iptv.domain.TenantConfig;
import quest.gekko.iptv.exception.ChannelNotFoundException;
import quest.gekko.iptv.exception.TenantNotConfiguredException;
import quest.gekko.iptv.repository.TenantStore;
import quest.gekko.iptv.service.scheduling.IngestionScheduler;
import quest.gekko.iptv.util.Tokens;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tenant lifecycle: registration, config replacement, deletion, manual re-ingestion and cache
 * clearing. Every change is audited.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantService {
    private final TenantStore tenantStore;
    private final TenantConfigValidator validator;
    private final IngestionScheduler scheduler;
    private final Clock clock;

    public record Registration(String tenant, IngestionReport report) {}

    public record CacheClearance(int channels, long images) {}

    /** Stores a new tenant under a fresh token, schedules it and runs a first ingestion. */
    public Registration register(final TenantConfig config, final String actor) {
        final TenantConfig valid = validator.validate(config);
        final String tenant = Tokens.generate();
        tenantStore.saveTenantConfig(tenant, valid);
        scheduler.schedule(tenant, valid);
        audit(actor, "tenant.register", tenant, Map.of("sources", Integer.toString(valid.sources().size())));
        log.info("Registered tenant {} with {} sources", Tokens.abbreviate(tenant), valid.sources().size());
        return new Registration(tenant, scheduler.triggerNow(tenant, valid));
    }

    /** Replaces the tenant's config wholesale, reschedules it and re-ingests. */
    public IngestionReport update(final String tenant, final TenantConfig config, final String actor) {
        requireConfig(tenant);
        final TenantConfig valid = validator.validate(config);
        tenantStore.saveTenantConfig(tenant, valid);
        tenantStore.invalidateManifest(tenant);
        scheduler.schedule(tenant, valid);
        audit(actor, "tenant.update", tenant, Map.of("cron", valid.cronSchedule()));
        return scheduler.triggerNow(tenant, valid);
    }

    /** Unschedules the tenant, lets a run in progress finish, then purges its data. */
    public boolean delete(final String tenant, final String actor) {
        scheduler.unschedule(tenant);
        scheduler.awaitIdle(tenant);
        final boolean existed = tenantStore.deleteTenant(tenant);
        audit(actor, "tenant.delete", tenant, Map.of("existed", Boolean.toString(existed)));
        return existed;
    }

    public IngestionReport reparse(final String tenant, final String actor) {
        final TenantConfig config = requireConfig(tenant);
        audit(actor, "tenant.reparse", tenant, Map.of());
        return scheduler.triggerNow(tenant, config);
    }

    /**
     * Drops the tenant's channels, guide data, manifest cache and the processed images of its
     * channels. The config stays; the next ingestion rebuilds the catalog.
     */
    public CacheClearance clearCache(final String tenant, final String actor) {
        requireConfig(tenant);
        final Set<String> channelIds = tenantStore.getAllChannels(tenant).keySet();
        final long images = tenantStore.invalidateProcessedImages(channelIds);
        final int channels = tenantStore.clearCatalog(tenant);
        audit(actor, "tenant.cache.clear", tenant,
                Map.of("channels", Integer.toString(channels), "images", Long.toString(images)));
        return new CacheClearance(channels, images);
    }

    /** Drops the processed images of every channel the tenant currently has. */
    public CacheClearance clearImageCache(final String tenant, final String actor) {
        requireConfig(tenant);
        final Set<String> channelIds = tenantStore.getAllChannels(tenant).keySet();
        final long images = tenantStore.invalidateProcessedImages(channelIds);
        audit(actor, "tenant.images.clear", tenant,
                Map.of("channels", Integer.toString(channelIds.size()), "images", Long.toString(images)));
        return new CacheClearance(channelIds.size(), images);
    }

    /** @throws ChannelNotFoundException when the tenant has no such channel */
    public long clearImageCache(final String tenant, final String channelId, final String actor) {
        requireConfig(tenant);
        if (tenantStore.getChannel(tenant, channelId).isEmpty()) {
            throw new ChannelNotFoundException(tenant, channelId);
        }
        final long images = tenantStore.invalidateProcessedImages(List.of(channelId));
        audit(actor, "channel.images.clear", tenant, Map.of("channel", channelId, "images", Long.toString(images)));
        return images;
    }

    public TenantConfig requireConfig(final String tenant) {
        return tenantStore.getTenantConfig(tenant).orElseThrow(() -> new TenantNotConfiguredException(tenant));
    }

    public List<IngestionReport> history(final String tenant, final int limit) {
        return tenantStore.getParseHistory(tenant, limit);
    }

    private void audit(final String actor, final String action, final String tenant, final Map<String, String> details) {
        tenantStore.appendAuditEntry(new AuditEntry(clock.instant(), actor, action, "tenant:" + Tokens.abbreviate(tenant), details));
    }
}
