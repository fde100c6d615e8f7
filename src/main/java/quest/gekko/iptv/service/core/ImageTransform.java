package quest.gekko.iptv.service.core;

import quest.gekko.iptv.domain.ImageKind;

/**
 * Resizes or renders a channel image for a given kind. Implemented by the image layer.
 */
@FunctionalInterface
public interface ImageTransform {

    byte[] render(String channelId, ImageKind kind, String sourceLogoUrl);
}
