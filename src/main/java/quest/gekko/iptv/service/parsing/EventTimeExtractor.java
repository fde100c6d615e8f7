package quest.gekko.iptv.service.parsing;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the start instant out of a noisy event name such as
 * {@code "NFL: Bears vs Packers (8:15 PM EST / 5:15 PM PST / 01:15 UK) Nov 9 2025"}.
 * Never throws; an unreadable name yields an empty result.
 */
@Slf4j
public class EventTimeExtractor {

    private static final Pattern ZONE_GROUP = Pattern.compile(
            "\\(([^)]*?(?:EST|EDT|CST|CDT|MST|MDT|PST|PDT|UK|UTC)[^)]*?)\\)");
    private static final Pattern MONTH_DASHED = Pattern.compile("([A-Za-z]{3,})-([0-9]{1,2})-([0-9]{4})");
    private static final Pattern UTC_QUALITY = Pattern.compile("UTC\\s+(?:HD|SD)\\b");
    private static final Pattern PAREN_TIME = Pattern.compile("\\(\\d{1,2}:\\d{2}");
    private static final Pattern MERIDIEM_TIME = Pattern.compile("\\d{1,2}:\\d{2} [AP]M");
    private static final Pattern LEADING_TIME = Pattern.compile("^\\d{1,2}:\\d{2}\\s+");
    private static final Pattern STRAY = Pattern.compile("[^A-Za-z0-9: \\-/]");

    private final ZonePreference zones;
    private final Clock clock;

    public EventTimeExtractor(final ZonePreference zones, final Clock clock) {
        this.zones = zones;
        this.clock = clock;
    }

    public Optional<Instant> extract(final String title) {
        if (title == null || title.isBlank()) return Optional.empty();
        try {
            final String normalized = normalize(title);
            final int referenceYear = clock.instant().atZone(ZoneOffset.UTC).getYear();
            final Optional<Instant> start = DateTimeHeuristics.parse(normalized, zones, referenceYear);
            log.debug("Event time of '{}' from '{}': {}", title, normalized, start.orElse(null));
            return start;
        } catch (RuntimeException e) {
            log.debug("Unreadable event time in '{}': {}", title, e.getMessage());
            return Optional.empty();
        }
    }

    String normalize(final String title) {
        String s = title.strip();

        if (s.contains("=")) {
            s = s.substring(0, s.indexOf('=')).strip();
        } else if (s.contains(" - ")) {
            s = s.substring(s.lastIndexOf(" - ") + 3).strip();
        }

        final Matcher group = ZONE_GROUP.matcher(s);
        if (group.find()) {
            final String segment = preferredSegment(group.group(1));
            final String outside = s.substring(0, group.start()) + " " + s.substring(group.end());
            s = segment;
            if (!EventPatterns.DATE.matcher(segment).find()) {
                final Matcher date = EventPatterns.DATE.matcher(outside);
                if (date.find()) s = date.group() + " " + segment;
            }
        }

        s = MONTH_DASHED.matcher(s).replaceAll("$1 $2 $3");
        s = UTC_QUALITY.matcher(s).replaceAll("UTC");
        s = PAREN_TIME.matcher(s).replaceAll("(");
        if (MERIDIEM_TIME.matcher(s).find()) {
            s = LEADING_TIME.matcher(s).replaceFirst("");
        }
        return STRAY.matcher(s).replaceAll(" ").strip();
    }

    /** The first segment, in zone preference order, that names a zone; else the first segment. */
    private String preferredSegment(final String inner) {
        final List<String> segments = Arrays.stream(inner.split("/")).map(String::strip).toList();
        for (String zone : zones.order()) {
            for (String segment : segments) {
                if (ZonePreference.contains(segment, zone)) return segment;
            }
        }
        return segments.get(0);
    }
}
