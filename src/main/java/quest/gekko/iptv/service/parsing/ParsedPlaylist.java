package quest.gekko.iptv.service.parsing;

import quest.gekko.iptv.domain.ChannelRecord;

import java.util.List;

/**
 * @param channels channel records in playlist order
 * @param epgUrls  guide URLs advertised in the {@code #EXTM3U} header
 */
public record ParsedPlaylist(List<ChannelRecord> channels, List<String> epgUrls) {

    public ParsedPlaylist {
        channels = List.copyOf(channels);
        epgUrls = List.copyOf(epgUrls);
    }
}
