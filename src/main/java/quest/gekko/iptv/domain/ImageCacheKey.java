package quest.gekko.iptv.domain;

/**
 * Global key of a processed image. Placeholder renders carry the generator version so that
 * a new placeholder design never serves stale images.
 */
public record ImageCacheKey(String channelId, ImageKind kind, Integer placeholderVersion) {

    public static ImageCacheKey of(String channelId, ImageKind kind) {
        return new ImageCacheKey(channelId, kind, null);
    }

    public static ImageCacheKey placeholder(String channelId, ImageKind kind, int version) {
        return new ImageCacheKey(channelId, kind, version);
    }

    public String cacheKey() {
        String base = baseKey(channelId, kind);
        return placeholderVersion == null ? base : base + "_placeholder_" + placeholderVersion;
    }

    public static String baseKey(String channelId, ImageKind kind) {
        return channelId + "_" + kind.key();
    }
}
