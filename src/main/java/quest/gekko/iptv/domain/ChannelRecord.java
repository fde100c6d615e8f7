package quest.gekko.iptv.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A standing channel or a dated event parsed from a playlist.
 * Event fields are only populated when {@code event} is true.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelRecord(
        String channelId,
        String name,
        String group,
        String logo,
        String streamUrl,
        Map<String, String> streamHeaders,
        String guideUrl,
        boolean event,
        String eventTitle,
        String eventSport,
        String eventTeam1,
        String eventTeam2,
        Instant eventStart
) {
    public ChannelRecord {
        streamHeaders = streamHeaders == null || streamHeaders.isEmpty() ? null : Map.copyOf(streamHeaders);
    }

    /** Title shown in catalogs: the formatted event title for events, the channel name otherwise. */
    public String displayTitle() {
        return event && eventTitle != null ? eventTitle : name;
    }

    /** Category used for catalog genres. */
    public String genre() {
        return event ? eventSport : group;
    }
}
