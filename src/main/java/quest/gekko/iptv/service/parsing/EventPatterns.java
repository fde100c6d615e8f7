package quest.gekko.iptv.service.parsing;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Patterns that tell an event entry ("11/08/2025 08:10 PM EST = Team A @ Team B") from a standing channel.
 */
public final class EventPatterns {

    public static final Pattern DATE = Pattern.compile(
            "\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}|\\b(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)\\b[ -]\\d{1,2}[, -]\\d{2,4}",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern TIME = Pattern.compile(
            "\\d{1,2}:\\d{2}(?::\\d{2})?\\s*(?:AM|PM)?\\s*(?:ET|EST|EDT|UTC)?\\s*=?\\s*",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern TEAMS = Pattern.compile(
            "(?<team1>.*?)\\s(?:@|VS)\\s(?<team2>.*)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[\\s=,\\-|]+|[\\s=,\\-|]+$");
    private static final Pattern QUALITY_TAG = Pattern.compile("\\s+(?:FHD|UHD|HD|SD|4K)$", Pattern.CASE_INSENSITIVE);

    private EventPatterns() {
    }

    public static boolean isEvent(final String name) {
        return name != null && DATE.matcher(name).find() && TIME.matcher(name).find();
    }

    /** The name without date, time and separator noise. */
    public static String cleanTitle(final String name) {
        String cleaned = DATE.matcher(name).replaceAll(" ");
        cleaned = TIME.matcher(cleaned).replaceAll(" ");
        cleaned = cleaned.replaceAll("\\s+", " ");
        cleaned = EDGE_SEPARATORS.matcher(cleaned).replaceAll("");
        cleaned = QUALITY_TAG.matcher(cleaned).replaceAll("");
        return EDGE_SEPARATORS.matcher(cleaned).replaceAll("");
    }

    /** "Team A @ Team B" or "Team A vs Team B". */
    public static Optional<Matchup> matchup(final String cleanedTitle) {
        final Matcher m = TEAMS.matcher(cleanedTitle);
        if (!m.find()) return Optional.empty();
        final String team1 = m.group("team1").strip();
        final String team2 = m.group("team2").strip();
        if (team1.isEmpty() || team2.isEmpty()) return Optional.empty();
        return Optional.of(new Matchup(team1, team2));
    }

    public record Matchup(String team1, String team2) {}
}
