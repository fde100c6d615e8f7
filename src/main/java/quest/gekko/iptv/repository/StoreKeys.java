package quest.gekko.iptv.repository;

import quest.gekko.iptv.domain.ImageCacheKey;
import quest.gekko.iptv.domain.ImageKind;
import quest.gekko.iptv.util.Tokens;

/**
 * Key layout of the store. Every tenant-scoped key is built from a validated tenant token,
 * so a channel id alone never addresses another tenant's data.
 */
public final class StoreKeys {

    public static final String TENANT_CONFIG = "tenant-config:";
    public static final String CHANNEL = "channel:";
    public static final String EPG = "epg:";
    public static final String LOGO_OVERRIDE = "logo-override:";
    public static final String PROCESSED_IMAGE = "processed-image:";
    public static final String MANIFEST = "manifest-cache:";
    public static final String RATE_LIMIT = "rate-limit:";
    public static final String AUDIT_LOG = "audit-log:";
    public static final String PARSE_HISTORY = "parse-history:";

    private StoreKeys() {
    }

    public static String tenantConfig(String tenant) {
        return TENANT_CONFIG + Tokens.requireValid(tenant);
    }

    public static String channelPrefix(String tenant) {
        return CHANNEL + Tokens.requireValid(tenant) + ":";
    }

    public static String channel(String tenant, String channelId) {
        return channelPrefix(tenant) + channelId;
    }

    public static String epg(String tenant) {
        return EPG + Tokens.requireValid(tenant);
    }

    public static String logoOverridePrefix(String tenant) {
        return LOGO_OVERRIDE + Tokens.requireValid(tenant) + ":";
    }

    public static String logoOverride(String tenant, String pattern) {
        return logoOverridePrefix(tenant) + pattern;
    }

    public static String processedImage(ImageCacheKey key) {
        return PROCESSED_IMAGE + key.cacheKey();
    }

    public static String processedImage(String channelId, ImageKind kind) {
        return PROCESSED_IMAGE + ImageCacheKey.baseKey(channelId, kind);
    }

    public static String processedPlaceholderPrefix(String channelId, ImageKind kind) {
        return processedImage(channelId, kind) + "_placeholder_";
    }

    public static String manifest(String tenant) {
        return MANIFEST + Tokens.requireValid(tenant);
    }

    public static String rateLimit(String client) {
        return RATE_LIMIT + client;
    }

    public static String auditLog(String timestamp, String id) {
        return AUDIT_LOG + timestamp + ":" + id;
    }

    public static String parseHistory(String tenant) {
        return PARSE_HISTORY + Tokens.requireValid(tenant);
    }
}
