package quest.gekko.iptv.service.parsing;

/**
 * Outcome of resolving a guide channel id against the playlist.
 */
public sealed interface MatchResult permits MatchResult.Matched, MatchResult.Unmatched {

    enum Strategy { EXACT_ID, NAME, NORMALIZED_ID }

    record Matched(String channelId, Strategy strategy) implements MatchResult {}

    record Unmatched(String epgChannelId) implements MatchResult {}
}
