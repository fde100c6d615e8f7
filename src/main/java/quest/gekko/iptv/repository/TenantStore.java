package quest.gekko.iptv.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Repository;
import quest.gekko.iptv.domain.AuditEntry;
import quest.gekko.iptv.domain.CatalogManifest;
import quest.gekko.iptv.domain.ChannelRecord;
import quest.gekko.iptv.domain.ImageCacheKey;
import quest.gekko.iptv.domain.ImageKind;
import quest.gekko.iptv.domain.IngestionReport;
import quest.gekko.iptv.domain.LogoOverride;
import quest.gekko.iptv.domain.ProgramEntry;
import quest.gekko.iptv.domain.TenantConfig;
import quest.gekko.iptv.exception.StoreUnavailableException;
import quest.gekko.iptv.util.Hashing;
import quest.gekko.iptv.util.Tokens;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Tenant-scoped persistence of configs, catalogs, guides and caches on top of a {@link KeyValueStore}.
 * Calls are retried on {@link StoreUnavailableException}; writes rethrow once retries are exhausted,
 * best-effort operations (audit, image cache, parse history) log and carry on.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class TenantStore {

    private static final TypeReference<Map<String, List<ProgramEntry>>> EPG_TYPE = new TypeReference<>() {};

    private final KeyValueStore store;
    private final ObjectMapper mapper;
    private final TtlPolicy ttlPolicy;
    private final RetryTemplate retry;
    private final Clock clock;

    /* ---------- channels ---------- */

    public int storeChannels(final String tenant, final Collection<ChannelRecord> records) {
        return storeChannels(tenant, records, clock.instant());
    }

    /**
     * Replaces the tenant's channel set in one batch: live records are written, events already past
     * their grace window are skipped, keys absent from the new set are deleted and the manifest
     * cache is dropped.
     *
     * @return number of records written
     */
    public int storeChannels(final String tenant, final Collection<ChannelRecord> records, final Instant now) {
        final String prefix = StoreKeys.channelPrefix(tenant);
        final Map<String, ChannelRecord> byId = new LinkedHashMap<>();
        for (ChannelRecord record : records) byId.put(record.channelId(), record);

        final List<KeyValueStore.Mutation> batch = new ArrayList<>();
        final Set<String> written = new HashSet<>();
        int skipped = 0;
        for (ChannelRecord record : byId.values()) {
            Duration ttl = null;
            if (record.event() && record.eventStart() != null) {
                final Optional<Duration> eventTtl = ttlPolicy.eventTtl(record.eventStart(), now);
                if (eventTtl.isEmpty()) {
                    log.debug("Skipping past event {} ({})", record.channelId(), record.eventStart());
                    skipped++;
                    continue;
                }
                ttl = eventTtl.get();
            }
            final String key = prefix + record.channelId();
            batch.add(new KeyValueStore.Put(key, write(record), ttl));
            written.add(key);
        }

        final Set<String> existing = withRetry(() -> store.keysWithPrefix(prefix));
        final List<String> stale = existing.stream().filter(k -> !written.contains(k)).toList();
        stale.forEach(k -> batch.add(new KeyValueStore.Delete(k)));
        batch.add(new KeyValueStore.Delete(StoreKeys.manifest(tenant)));

        withRetry(() -> {
            store.apply(batch);
            return null;
        });
        log.info("Stored {} channels for tenant {} ({} past events skipped, {} stale removed)",
                written.size(), Tokens.abbreviate(tenant), skipped, stale.size());
        return written.size();
    }

    /** Live channel set keyed by channel id. */
    public Map<String, ChannelRecord> getAllChannels(final String tenant) {
        final String prefix = StoreKeys.channelPrefix(tenant);
        final Map<String, String> raw = withRetry(() -> store.getAllWithPrefix(prefix));
        final Map<String, ChannelRecord> channels = new TreeMap<>();
        raw.forEach((key, json) -> read(json, ChannelRecord.class, key)
                .ifPresent(record -> channels.put(key.substring(prefix.length()), record)));
        return channels;
    }

    public Optional<ChannelRecord> getChannel(final String tenant, final String channelId) {
        final String key = StoreKeys.channel(tenant, channelId);
        return withRetry(() -> store.get(key)).flatMap(json -> read(json, ChannelRecord.class, key));
    }

    /* ---------- EPG ---------- */

    public void storeEpg(final String tenant, final Map<String, List<ProgramEntry>> programs) {
        final String key = StoreKeys.epg(tenant);
        final String json = write(programs);
        withRetry(() -> {
            store.put(key, json, ttlPolicy.epgTtl());
            return null;
        });
    }

    public Map<String, List<ProgramEntry>> getEpg(final String tenant) {
        final String key = StoreKeys.epg(tenant);
        return withRetry(() -> store.get(key))
                .flatMap(json -> read(json, EPG_TYPE, key))
                .orElse(Map.of());
    }

    /** @return the channel's programs, empty when the guide has no entry for it */
    public Optional<List<ProgramEntry>> getChannelPrograms(final String tenant, final String channelId) {
        return Optional.ofNullable(getEpg(tenant).get(channelId));
    }

    /**
     * Drops the tenant's channel set, guide data and manifest cache. The config and logo overrides
     * stay, so the next ingestion rebuilds the catalog.
     *
     * @return number of channel records removed
     */
    public int clearCatalog(final String tenant) {
        final Set<String> channelKeys = withRetry(() -> store.keysWithPrefix(StoreKeys.channelPrefix(tenant)));
        final List<KeyValueStore.Mutation> batch = new ArrayList<>();
        channelKeys.forEach(k -> batch.add(new KeyValueStore.Delete(k)));
        batch.add(new KeyValueStore.Delete(StoreKeys.epg(tenant)));
        batch.add(new KeyValueStore.Delete(StoreKeys.manifest(tenant)));
        withRetry(() -> {
            store.apply(batch);
            return null;
        });
        log.info("Cleared catalog of tenant {} ({} channels)", Tokens.abbreviate(tenant), channelKeys.size());
        return channelKeys.size();
    }

    /* ---------- tenant configs ---------- */

    public void saveTenantConfig(final String tenant, final TenantConfig config) {
        final String key = StoreKeys.tenantConfig(tenant);
        final String json = write(config);
        withRetry(() -> {
            store.put(key, json, null);
            return null;
        });
    }

    public Optional<TenantConfig> getTenantConfig(final String tenant) {
        final String key = StoreKeys.tenantConfig(tenant);
        return withRetry(() -> store.get(key)).flatMap(json -> read(json, TenantConfig.class, key));
    }

    public List<String> listTenants() {
        return withRetry(() -> store.keysWithPrefix(StoreKeys.TENANT_CONFIG)).stream()
                .map(k -> k.substring(StoreKeys.TENANT_CONFIG.length()))
                .sorted()
                .toList();
    }

    /**
     * Removes everything stored for a tenant.
     *
     * @return whether the tenant had a config
     */
    public boolean deleteTenant(final String tenant) {
        final String configKey = StoreKeys.tenantConfig(tenant);
        final boolean existed = withRetry(() -> store.get(configKey)).isPresent();

        final List<KeyValueStore.Mutation> batch = new ArrayList<>();
        batch.add(new KeyValueStore.Delete(configKey));
        batch.add(new KeyValueStore.Delete(StoreKeys.epg(tenant)));
        batch.add(new KeyValueStore.Delete(StoreKeys.manifest(tenant)));
        batch.add(new KeyValueStore.Delete(StoreKeys.parseHistory(tenant)));
        withRetry(() -> store.keysWithPrefix(StoreKeys.channelPrefix(tenant)))
                .forEach(k -> batch.add(new KeyValueStore.Delete(k)));
        withRetry(() -> store.keysWithPrefix(StoreKeys.logoOverridePrefix(tenant)))
                .forEach(k -> batch.add(new KeyValueStore.Delete(k)));

        withRetry(() -> {
            store.apply(batch);
            return null;
        });
        log.info("Purged tenant {} ({} keys)", Tokens.abbreviate(tenant), batch.size());
        return existed;
    }

    /* ---------- logo overrides ---------- */

    public void saveLogoOverride(final String tenant, final LogoOverride override) {
        final String key = StoreKeys.logoOverride(tenant, override.pattern());
        final String json = write(override);
        withRetry(() -> {
            store.put(key, json, null);
            return null;
        });
    }

    public List<LogoOverride> getLogoOverrides(final String tenant) {
        final Map<String, String> raw = withRetry(() -> store.getAllWithPrefix(StoreKeys.logoOverridePrefix(tenant)));
        final List<LogoOverride> overrides = new ArrayList<>();
        raw.forEach((key, json) -> read(json, LogoOverride.class, key).ifPresent(overrides::add));
        overrides.sort(Comparator.comparing(LogoOverride::pattern));
        return overrides;
    }

    /** @return the removed override, if there was one */
    public Optional<LogoOverride> deleteLogoOverride(final String tenant, final String pattern) {
        final String key = StoreKeys.logoOverride(tenant, pattern);
        final Optional<LogoOverride> existing = withRetry(() -> store.get(key))
                .flatMap(json -> read(json, LogoOverride.class, key));
        withRetry(() -> store.delete(key));
        return existing;
    }

    /* ---------- processed images ---------- */

    public Optional<byte[]> getProcessedImage(final ImageCacheKey key) {
        final String storeKey = StoreKeys.processedImage(key);
        try {
            return withRetry(() -> store.get(storeKey)).map(Base64.getDecoder()::decode);
        } catch (StoreUnavailableException e) {
            log.warn("Image cache read failed for {}: {}", storeKey, e.getMessage());
            return Optional.empty();
        }
    }

    public void storeProcessedImage(final ImageCacheKey key, final byte[] image) {
        final String storeKey = StoreKeys.processedImage(key);
        try {
            final String encoded = Base64.getEncoder().encodeToString(image);
            withRetry(() -> {
                store.put(storeKey, encoded, ttlPolicy.imageTtl());
                return null;
            });
        } catch (StoreUnavailableException e) {
            log.warn("Image cache write failed for {}: {}", storeKey, e.getMessage());
        }
    }

    /**
     * Drops cached images of the given channels, every kind and every placeholder version.
     *
     * @return number of entries removed
     */
    public long invalidateProcessedImages(final Collection<String> channelIds) {
        final Set<String> keys = new HashSet<>();
        for (String channelId : channelIds) {
            for (ImageKind kind : ImageKind.values()) {
                keys.add(StoreKeys.processedImage(channelId, kind));
                keys.addAll(withRetry(() -> store.keysWithPrefix(StoreKeys.processedPlaceholderPrefix(channelId, kind))));
            }
        }
        if (keys.isEmpty()) return 0;
        final long removed = withRetry(() -> store.delete(keys));
        log.debug("Invalidated {} processed images for {} channels", removed, channelIds.size());
        return removed;
    }

    /* ---------- manifest cache ---------- */

    public Optional<CatalogManifest> getManifest(final String tenant) {
        final String key = StoreKeys.manifest(tenant);
        return withRetry(() -> store.get(key)).flatMap(json -> read(json, CatalogManifest.class, key));
    }

    public void storeManifest(final String tenant, final CatalogManifest manifest) {
        final String key = StoreKeys.manifest(tenant);
        final String json = write(manifest);
        withRetry(() -> {
            store.put(key, json, ttlPolicy.manifestTtl());
            return null;
        });
    }

    public void invalidateManifest(final String tenant) {
        final String key = StoreKeys.manifest(tenant);
        withRetry(() -> store.delete(key));
    }

    /* ---------- rate limiting ---------- */

    public OptionalLong tryIncrement(final String client, final long ceiling, final Duration window) {
        final String key = StoreKeys.rateLimit(client);
        return withRetry(() -> store.tryIncrement(key, ceiling, window));
    }

    public Optional<Duration> rateLimitResetIn(final String client) {
        final String key = StoreKeys.rateLimit(client);
        return withRetry(() -> store.ttl(key));
    }

    /* ---------- audit log and parse history ---------- */

    public void appendAuditEntry(final AuditEntry entry) {
        try {
            final String json = write(entry);
            final String key = StoreKeys.auditLog(Long.toString(entry.timestamp().toEpochMilli()),
                    Hashing.sha256Hex(json).substring(0, 16));
            withRetry(() -> {
                store.put(key, json, ttlPolicy.auditTtl());
                return null;
            });
        } catch (StoreUnavailableException e) {
            log.warn("Audit entry {} {} not recorded: {}", entry.action(), entry.resource(), e.getMessage());
        }
    }

    /** Audit entries still retained, oldest first. */
    public List<AuditEntry> getAuditEntries() {
        final Map<String, String> raw = withRetry(() -> store.getAllWithPrefix(StoreKeys.AUDIT_LOG));
        final List<AuditEntry> entries = new ArrayList<>();
        raw.forEach((key, json) -> read(json, AuditEntry.class, key).ifPresent(entries::add));
        entries.sort(Comparator.comparing(AuditEntry::timestamp));
        return entries;
    }

    public void appendParseHistory(final String tenant, final IngestionReport report) {
        final String key = StoreKeys.parseHistory(tenant);
        try {
            final String json = write(report);
            withRetry(() -> {
                store.pushBounded(key, json, TtlPolicy.PARSE_HISTORY_LENGTH, ttlPolicy.auditTtl());
                return null;
            });
        } catch (StoreUnavailableException e) {
            log.warn("Parse history for tenant {} not recorded: {}", Tokens.abbreviate(tenant), e.getMessage());
        }
    }

    /** Most recent reports first. */
    public List<IngestionReport> getParseHistory(final String tenant, final int limit) {
        final String key = StoreKeys.parseHistory(tenant);
        try {
            final List<String> raw = withRetry(() -> store.range(key, Math.min(limit, TtlPolicy.PARSE_HISTORY_LENGTH)));
            final List<IngestionReport> reports = new ArrayList<>();
            raw.forEach(json -> read(json, IngestionReport.class, key).ifPresent(reports::add));
            return reports;
        } catch (StoreUnavailableException e) {
            log.warn("Parse history for tenant {} unavailable: {}", Tokens.abbreviate(tenant), e.getMessage());
            return List.of();
        }
    }

    /* ---------- helpers ---------- */

    private <T> T withRetry(final Supplier<T> action) {
        return retry.execute(ctx -> action.get());
    }

    private String write(final Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> Optional<T> read(final String json, final Class<T> type, final String key) {
        try {
            return Optional.of(mapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable value at {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private <T> Optional<T> read(final String json, final TypeReference<T> type, final String key) {
        try {
            return Optional.of(mapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable value at {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
