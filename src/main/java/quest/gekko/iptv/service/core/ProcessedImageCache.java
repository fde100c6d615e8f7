package quest.gekko.iptv.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.iptv.domain.ImageCacheKey;
import quest.gekko.iptv.repository.TenantStore;

import java.util.Optional;

/**
 * Read-through cache of rendered images. Cache trouble never fails a render.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProcessedImageCache {
    private final TenantStore tenantStore;

    public Optional<byte[]> get(final ImageCacheKey key) {
        return tenantStore.getProcessedImage(key);
    }

    public byte[] getOrRender(final ImageCacheKey key, final String sourceLogoUrl, final ImageTransform transform) {
        final Optional<byte[]> cached = tenantStore.getProcessedImage(key);
        if (cached.isPresent()) return cached.get();

        log.debug("Rendering {} image for {}", key.kind(), key.channelId());
        final byte[] rendered = transform.render(key.channelId(), key.kind(), sourceLogoUrl);
        if (rendered != null && rendered.length > 0) {
            tenantStore.storeProcessedImage(key, rendered);
        }
        return rendered;
    }
}
