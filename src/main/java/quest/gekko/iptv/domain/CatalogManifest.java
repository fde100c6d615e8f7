package quest.gekko.iptv.domain;

import java.util.List;

/**
 * Catalog summary for a tenant: distinct channel categories and distinct event sports, both sorted.
 */
public record CatalogManifest(List<String> channelGenres, List<String> eventGenres) {

    public CatalogManifest {
        channelGenres = channelGenres == null ? List.of() : List.copyOf(channelGenres);
        eventGenres = eventGenres == null ? List.of() : List.copyOf(eventGenres);
    }
}
