package quest.gekko.iptv.service.parsing;

import lombok.extern.slf4j.Slf4j;
import quest.gekko.iptv.domain.ChannelRecord;
import quest.gekko.iptv.domain.ProgramEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps guide channel ids onto playlist channel ids. Strategies are tried in order, each over all
 * playlist channels in playlist order: exact id, then normalized name, then normalized id.
 */
@Slf4j
public class ChannelMatcher {

    public MatchResult match(final String epgChannelId, final List<ChannelRecord> channels) {
        for (ChannelRecord channel : channels) {
            if (epgChannelId.equals(channel.channelId())) {
                return new MatchResult.Matched(channel.channelId(), MatchResult.Strategy.EXACT_ID);
            }
        }
        final String wanted = normalize(epgChannelId);
        if (wanted.isEmpty()) return new MatchResult.Unmatched(epgChannelId);
        for (ChannelRecord channel : channels) {
            if (related(wanted, normalize(channel.name()))) {
                return new MatchResult.Matched(channel.channelId(), MatchResult.Strategy.NAME);
            }
        }
        for (ChannelRecord channel : channels) {
            if (related(wanted, normalize(channel.channelId()))) {
                return new MatchResult.Matched(channel.channelId(), MatchResult.Strategy.NORMALIZED_ID);
            }
        }
        return new MatchResult.Unmatched(epgChannelId);
    }

    /**
     * Re-keys guide programs by playlist channel id. Programs of several guide ids resolving to the
     * same channel are merged and re-sorted; unmatched guide ids are dropped.
     */
    public Map<String, List<ProgramEntry>> merge(final Map<String, List<ProgramEntry>> epg, final List<ChannelRecord> channels) {
        final Map<String, List<ProgramEntry>> merged = new LinkedHashMap<>();
        int unmatched = 0;
        for (Map.Entry<String, List<ProgramEntry>> entry : epg.entrySet()) {
            final MatchResult result = match(entry.getKey(), channels);
            if (result instanceof MatchResult.Matched matched) {
                log.debug("Guide channel {} -> {} ({})", entry.getKey(), matched.channelId(), matched.strategy());
                merged.computeIfAbsent(matched.channelId(), k -> new ArrayList<>()).addAll(entry.getValue());
            } else {
                log.debug("No playlist channel for guide channel {}", entry.getKey());
                unmatched++;
            }
        }
        if (unmatched > 0) {
            log.warn("{} of {} guide channels matched no playlist channel", unmatched, epg.size());
        }
        merged.values().forEach(list -> list.sort(Comparator.comparing(ProgramEntry::start)));
        return merged;
    }

    static String normalize(final String value) {
        if (value == null) return "";
        return value.toLowerCase(Locale.ROOT).replace('.', ' ').replace('_', ' ').replaceAll("\\s+", " ").strip();
    }

    private static boolean related(final String wanted, final String candidate) {
        if (candidate.isEmpty()) return false;
        return wanted.equals(candidate) || candidate.contains(wanted) || wanted.contains(candidate);
    }
}
